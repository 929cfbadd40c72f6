package com.vidnyan.causeway.domain.error;

/**
 * Raised when mechanisms cannot be fitted to a graph.
 */
public class FittingException extends CausalException {

    public FittingException(String message) {
        super(message);
    }

    public FittingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorFamily family() {
        return ErrorFamily.FITTING;
    }
}
