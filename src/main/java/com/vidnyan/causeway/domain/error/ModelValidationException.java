package com.vidnyan.causeway.domain.error;

import java.util.List;

/**
 * The fitted model did not reach the required R² on held-out data.
 */
public class ModelValidationException extends FittingException {

    private final double meanR2;
    private final List<String> failedNodes;

    public ModelValidationException(String message, double meanR2, List<String> failedNodes) {
        super(message);
        this.meanR2 = meanR2;
        this.failedNodes = List.copyOf(failedNodes);
    }

    public double meanR2() {
        return meanR2;
    }

    public List<String> failedNodes() {
        return failedNodes;
    }
}
