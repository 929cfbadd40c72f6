package com.vidnyan.causeway.domain.error;

/**
 * Raised when node code cannot be prepared or executed for trace collection.
 */
public class TraceCollectionException extends CausalException {

    public TraceCollectionException(String message) {
        super(message);
    }

    public TraceCollectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorFamily family() {
        return ErrorFamily.TRACE_COLLECTION;
    }
}
