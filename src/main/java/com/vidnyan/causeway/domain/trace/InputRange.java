package com.vidnyan.causeway.domain.trace;

/**
 * Closed interval a free input is sampled from.
 */
public record InputRange(double min, double max) {

    public static final InputRange DEFAULT = new InputRange(-10.0, 10.0);

    public InputRange {
        if (!(min <= max)) {
            throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "]");
        }
    }
}
