package com.vidnyan.causeway.domain.error;

/**
 * Raised by the validation engine when scores cannot be computed.
 */
public class StatisticalValidationException extends CausalException {

    public StatisticalValidationException(String message) {
        super(message);
    }

    public StatisticalValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorFamily family() {
        return ErrorFamily.FITTING;
    }
}
