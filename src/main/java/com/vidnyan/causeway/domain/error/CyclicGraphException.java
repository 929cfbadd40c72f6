package com.vidnyan.causeway.domain.error;

import java.util.List;

/**
 * Raised when a graph that must be acyclic contains a cycle.
 */
public class CyclicGraphException extends GraphBuildException {

    private final List<String> cycle;

    public CyclicGraphException(List<String> cycle) {
        super("Graph contains cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
