package com.vidnyan.causeway.domain.error;

/**
 * Intervention refers to something the graph does not have.
 */
public class InterventionValidationException extends InterventionException {

    public InterventionValidationException(String message) {
        super(message);
    }

    public InterventionValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
