package com.vidnyan.causeway.domain.error;

/**
 * Too many simulation trials failed.
 */
public class TraceExecutionException extends TraceCollectionException {

    public TraceExecutionException(String message) {
        super(message);
    }

    public TraceExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
