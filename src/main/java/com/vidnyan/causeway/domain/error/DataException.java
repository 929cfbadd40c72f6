package com.vidnyan.causeway.domain.error;

/**
 * Traces and graph disagree on the set of nodes.
 */
public class DataException extends FittingException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
