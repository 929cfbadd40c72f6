package com.vidnyan.causeway.domain.error;

/**
 * Malformed intervention request.
 */
public class InterventionParseException extends InterventionException {

    public InterventionParseException(String message) {
        super(message);
    }

    public InterventionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
