package com.vidnyan.causeway.domain.error;

/**
 * Raised when a causal graph cannot be built from a source tree.
 */
public class GraphBuildException extends CausalException {

    public GraphBuildException(String message) {
        super(message);
    }

    public GraphBuildException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorFamily family() {
        return ErrorFamily.GRAPH_CONSTRUCTION;
    }
}
