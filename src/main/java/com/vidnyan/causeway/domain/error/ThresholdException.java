package com.vidnyan.causeway.domain.error;

import com.vidnyan.causeway.domain.validation.ValidationResult;

/**
 * Cross-validation completed but the aggregate or a node fell below the threshold.
 */
public class ThresholdException extends StatisticalValidationException {

    private final transient ValidationResult result;

    public ThresholdException(String message, ValidationResult result) {
        super(message);
        this.result = result;
    }

    public ValidationResult result() {
        return result;
    }
}
