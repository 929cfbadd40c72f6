package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.graph.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes edges touching observational-only operations (logging, printing,
 * formatting, type introspection, assertions).
 */
@Slf4j
@Component
public class EdgePruner {

    public static final Set<String> NON_CAUSAL_OPERATIONS = Set.of(
            "print", "println", "printf", "log", "trace", "debug", "info", "warn", "warning",
            "error", "critical", "format", "toString", "valueOf", "getClass", "isInstance",
            "hashCode", "assert", "assertTrue", "assertFalse", "assertEquals", "assertNotNull"
    );

    public CausalGraph prune(CausalGraph graph) {
        return prune(graph, true);
    }

    /**
     * @param dropIsolated also remove non-causal nodes left without any edge
     */
    public CausalGraph prune(CausalGraph graph, boolean dropIsolated) {
        Set<String> nonCausal = graph.nodes().stream()
                .filter(EdgePruner::isNonCausal)
                .map(GraphNode::id)
                .collect(Collectors.toSet());

        if (nonCausal.isEmpty()) {
            return graph;
        }

        CausalGraph.Builder builder = graph.toBuilder().removeEdgesTouching(nonCausal);
        if (dropIsolated) {
            builder.removeIsolated(nonCausal);
        }
        CausalGraph pruned = builder.build();
        log.debug("Pruned {} non-causal nodes: {} -> {} edges",
                nonCausal.size(), graph.edgeCount(), pruned.edgeCount());
        return pruned;
    }

    static boolean isNonCausal(GraphNode node) {
        return node.kind() == NodeKind.EFFECT
                && node.operation() != null
                && NON_CAUSAL_OPERATIONS.contains(node.operation());
    }
}
