package com.vidnyan.causeway.domain.error;

public class InsufficientDataException extends StatisticalValidationException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
