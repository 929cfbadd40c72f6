package com.vidnyan.causeway.domain.error;

/**
 * Failure crossing the process boundary to the structural causal model service.
 * Carries whatever raw output the service produced.
 */
public class ExternalServiceException extends CausalException {

    private final String rawOutput;
    private final String traceback;

    public ExternalServiceException(String message) {
        this(message, null, null, null);
    }

    public ExternalServiceException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ExternalServiceException(String message, String rawOutput, String traceback, Throwable cause) {
        super(message, cause);
        this.rawOutput = rawOutput;
        this.traceback = traceback;
    }

    public String rawOutput() {
        return rawOutput;
    }

    public String traceback() {
        return traceback;
    }

    @Override
    public ErrorFamily family() {
        return ErrorFamily.EXTERNAL_SERVICE;
    }
}
