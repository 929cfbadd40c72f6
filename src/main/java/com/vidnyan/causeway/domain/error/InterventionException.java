package com.vidnyan.causeway.domain.error;

/**
 * Raised when an intervention query cannot be executed.
 */
public class InterventionException extends CausalException {

    public InterventionException(String message) {
        super(message);
    }

    public InterventionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorFamily family() {
        return ErrorFamily.INTERVENTION;
    }
}
