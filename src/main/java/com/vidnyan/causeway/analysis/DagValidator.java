package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.error.CyclicGraphException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.GraphStructureReport;
import org.springframework.stereotype.Component;

@Component
public class DagValidator {

    /**
     * @throws CyclicGraphException with the discovered cycle
     */
    public void validate(CausalGraph graph) {
        graph.findCycle().ifPresent(cycle -> {
            throw new CyclicGraphException(cycle);
        });
    }

    /**
     * Structural flags for diagnostics. Never throws.
     */
    public GraphStructureReport checkStructure(CausalGraph graph) {
        long n = graph.nodeCount();
        return new GraphStructureReport(
                graph.isAcyclic(),
                !graph.roots().isEmpty(),
                !graph.leaves().isEmpty(),
                n == 0 || graph.edgeCount() <= n * n
        );
    }
}
