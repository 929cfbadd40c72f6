package com.vidnyan.causeway.domain.error;

/**
 * Base type for every failure raised by the causal pipeline.
 */
public abstract class CausalException extends RuntimeException {

    protected CausalException(String message) {
        super(message);
    }

    protected CausalException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorFamily family();
}
