package com.vidnyan.causeway.domain.validation;

import java.util.List;

/**
 * R² of one node's mechanism on held-out data.
 */
public record R2Score(
    String nodeId,
    double rSquared,
    double ssRes,
    double ssTot,
    int nSamples,
    List<String> parentNodes
) {

    public R2Score {
        parentNodes = List.copyOf(parentNodes);
    }

    public boolean passes(double threshold) {
        return rSquared >= threshold;
    }
}
