package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.error.CausalException;
import com.vidnyan.causeway.domain.error.GraphBuildException;
import com.vidnyan.causeway.domain.graph.*;
import com.vidnyan.causeway.domain.syntax.ScopeContext;
import com.vidnyan.causeway.domain.syntax.SourceTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Node extraction, data and control flow, call linking, pruning and DAG validation
 * in one pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CausalGraphBuilder {

    private final NodeExtractor nodeExtractor;
    private final DataFlowExtractor dataFlowExtractor;
    private final ControlFlowExtractor controlFlowExtractor;
    private final CallGraphExtractor callGraphExtractor;
    private final EdgePruner edgePruner;
    private final DagValidator dagValidator;

    public static CausalGraphBuilder withDefaults() {
        return new CausalGraphBuilder(
                new NodeExtractor(),
                new DataFlowExtractor(),
                new ControlFlowExtractor(),
                new CallGraphExtractor(),
                new EdgePruner(),
                new DagValidator());
    }

    public CausalGraph build(SourceTree tree) {
        return build(tree, null);
    }

    /**
     * @param callGraph caller to callee relation; derived from the tree when null or empty
     * @throws GraphBuildException          if no nodes can be extracted or a stage fails
     * @throws com.vidnyan.causeway.domain.error.CyclicGraphException if the result has a cycle
     */
    public CausalGraph build(SourceTree tree, CallGraph callGraph) {
        try {
            List<GraphNode> nodes = nodeExtractor.extract(tree);
            if (nodes.isEmpty()) {
                throw new GraphBuildException("No causal nodes found in " + tree.origin());
            }

            CausalGraph.Builder builder = CausalGraph.builder().addNodes(nodes);
            builder.addEdges(dataFlowExtractor.extract(tree, nodes));
            builder.addEdges(controlFlowExtractor.extract(tree, nodes));

            CallGraph calls = callGraph == null || callGraph.isEmpty()
                    ? callGraphExtractor.extract(tree)
                    : callGraph;
            builder.addEdges(callEdges(nodes, calls));

            CausalGraph graph = edgePruner.prune(builder.build());
            dagValidator.validate(graph);

            GraphStructureReport report = dagValidator.checkStructure(graph);
            if (!report.isValid()) {
                throw new GraphBuildException("Invalid graph structure: " + report);
            }

            CausalGraph.Stats stats = graph.stats();
            log.info("Built causal graph: {} nodes, {} edges ({} data-flow, {} control-flow)",
                    stats.nodeCount(), stats.edgeCount(), stats.dataFlowEdges(), stats.controlFlowEdges());
            return graph;
        } catch (CausalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GraphBuildException("Failed to build causal graph: " + e.getMessage(), e);
        }
    }

    /**
     * Each return of a callee feeds the calling function.
     */
    private List<CausalEdge> callEdges(List<GraphNode> nodes, CallGraph calls) {
        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode node : nodes) {
            byId.put(node.id(), node);
        }
        Map<String, List<GraphNode>> returnsByScope = new HashMap<>();
        for (GraphNode node : nodes) {
            if (node.kind() == NodeKind.RETURN) {
                returnsByScope.computeIfAbsent(node.scope(), k -> new ArrayList<>()).add(node);
            }
        }

        List<CausalEdge> edges = new ArrayList<>();
        for (CallEdge call : calls.edges()) {
            GraphNode callee = byId.get(call.calleeId());
            if (callee == null || !byId.containsKey(call.callerId())) {
                continue;
            }
            String calleeBody = ScopeContext.MODULE.equals(callee.scope())
                    ? callee.name()
                    : callee.scope() + "." + callee.name();
            for (GraphNode ret : returnsByScope.getOrDefault(calleeBody, List.of())) {
                edges.add(CausalEdge.dataFlow(ret.id(), call.callerId()));
            }
        }
        return edges;
    }
}
