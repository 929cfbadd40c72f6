package com.vidnyan.causeway.domain.error;

public class InputGenerationException extends TraceCollectionException {

    public InputGenerationException(String message) {
        super(message);
    }

    public InputGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
