package com.vidnyan.causeway.domain.graph;

/**
 * Directed influence between two graph nodes.
 * Two edges are equal when source, target and kind all match.
 */
public record CausalEdge(String source, String target, EdgeKind kind) {

    public static CausalEdge dataFlow(String source, String target) {
        return new CausalEdge(source, target, EdgeKind.DATA_FLOW);
    }

    public static CausalEdge controlFlow(String source, String target) {
        return new CausalEdge(source, target, EdgeKind.CONTROL_FLOW);
    }

    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }
}
