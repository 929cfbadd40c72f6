package com.vidnyan.causeway.domain.graph;

/**
 * Diagnostic structure flags for a causal graph.
 */
public record GraphStructureReport(
    boolean isDag,
    boolean hasRoots,
    boolean hasLeaves,
    boolean edgeCountWithinBound
) {

    public boolean isValid() {
        return isDag && hasRoots && hasLeaves && edgeCountWithinBound;
    }
}
