package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.error.CyclicGraphException;
import com.vidnyan.causeway.domain.error.GraphBuildException;
import com.vidnyan.causeway.domain.graph.*;
import com.vidnyan.causeway.domain.syntax.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CausalGraphBuilderTest {

    private static final String X2 = "var:__module__.x:L2";
    private static final String Y3 = "var:__module__.y:L3";
    private static final String X4 = "var:__module__.x:L4";
    private static final String Z5 = "var:__module__.z:L5";

    private final CausalGraphBuilder builder = CausalGraphBuilder.withDefaults();

    private static Assignment assign(String target, int line, String... reads) {
        return new Assignment(target, line, List.of(reads), false, "=", null);
    }

    private static SourceTree reassignment() {
        return SourceTree.of(
                assign("x", 2),
                assign("y", 3, "x"),
                assign("x", 4),
                assign("z", 5, "x", "y"));
    }

    @Test
    void build_LinksUseToMostRecentDefinition() {
        // Act
        CausalGraph graph = builder.build(reassignment());

        // Assert
        assertEquals(4, graph.nodeCount());
        assertTrue(graph.hasEdge(X2, Y3));
        assertTrue(graph.hasEdge(X4, Z5));
        assertTrue(graph.hasEdge(Y3, Z5));
        assertFalse(graph.hasEdge(X2, Z5), "z must only see the x defined on line 4");
        assertEquals(3, graph.edgeCount());
    }

    @Test
    void build_IsIdempotent() {
        CausalGraph first = builder.build(reassignment());
        CausalGraph second = builder.build(reassignment());

        assertEquals(first.nodeIds(), second.nodeIds());
        assertEquals(first.edges(), second.edges());
    }

    @Test
    void build_AugmentedAssignmentReadsPreviousDefinition() {
        SourceTree tree = SourceTree.of(
                assign("total", 1),
                new Assignment("total", 2, List.of("step"), true, "+=", null),
                assign("step", 3));

        CausalGraph graph = builder.build(tree);

        assertTrue(graph.hasEdge("var:__module__.total:L1", "var:__module__.total:L2"));
        // step is defined after line 2, so nothing reaches back
        assertFalse(graph.hasEdge("var:__module__.step:L3", "var:__module__.total:L2"));
    }

    @Test
    void build_ReturnNodesFeedFunctionScope() {
        FunctionDef function = new FunctionDef("double_it", 1, 4, List.of("a"), List.of(), false,
                "int double_it(int a) { int b = a * 2; return b; }",
                List.of(assign("b", 2, "a"), new Return(3, List.of("b"), true)));

        CausalGraph graph = builder.build(SourceTree.of(function));

        assertTrue(graph.containsNode("func:double_it"));
        assertTrue(graph.hasEdge("var:double_it.b:L2", "return:double_it:L3"));
        assertEquals(NodeKind.FUNCTION, graph.node("func:double_it").orElseThrow().kind());
    }

    @Test
    void build_PrunesPrintingCalls() {
        SourceTree tree = SourceTree.of(
                assign("a", 1),
                new Call("println", "System.out", 2),
                assign("b", 3, "a"));

        CausalGraph graph = builder.build(tree);

        assertTrue(graph.hasEdge("var:__module__.a:L1", "var:__module__.b:L3"));
        assertTrue(graph.nodes().stream().noneMatch(n -> n.kind() == NodeKind.EFFECT));
    }

    @Test
    void build_EmptyTreeFails() {
        assertThrows(GraphBuildException.class, () -> builder.build(new SourceTree("empty.java", List.of())));
    }

    @Test
    void edgePruner_KeepsStateChangingEffects() {
        // Arrange
        GraphNode print = new GraphNode("effect:f.print:L2", "print()", NodeKind.EFFECT, 2, "f",
                Map.of(GraphNode.OPERATION, "print"));
        GraphNode append = new GraphNode("effect:f.append:L3", "append()", NodeKind.EFFECT, 3, "f",
                Map.of(GraphNode.OPERATION, "append"));
        CausalGraph graph = CausalGraph.builder()
                .addNode(print)
                .addNode(append)
                .addEdge(CausalEdge.dataFlow("a", print.id()))
                .addEdge(CausalEdge.dataFlow("a", append.id()))
                .addEdge(CausalEdge.dataFlow("a", "b"))
                .build();

        // Act
        CausalGraph pruned = new EdgePruner().prune(graph);

        // Assert
        assertFalse(pruned.containsNode(print.id()));
        assertTrue(pruned.hasEdge("a", append.id()));
        assertTrue(pruned.hasEdge("a", "b"));
    }

    @Test
    void edgePruner_CanKeepIsolatedNodes() {
        GraphNode log = new GraphNode("effect:f.info:L2", "info()", NodeKind.EFFECT, 2, "f",
                Map.of(GraphNode.OPERATION, "info"));
        CausalGraph graph = CausalGraph.builder()
                .addNode(log)
                .addEdge(CausalEdge.dataFlow("a", log.id()))
                .build();

        CausalGraph pruned = new EdgePruner().prune(graph, false);

        assertTrue(pruned.containsNode(log.id()));
        assertEquals(0, pruned.edgeCount());
    }

    @Test
    void dagValidator_ReportsCycle() {
        CausalGraph cyclic = CausalGraph.ofEdges(new String[] {"a", "b"}, new String[] {"b", "c"},
                new String[] {"c", "a"});
        DagValidator validator = new DagValidator();

        assertThrows(CyclicGraphException.class, () -> validator.validate(cyclic));
        assertFalse(validator.checkStructure(cyclic).isDag());
        assertFalse(validator.checkStructure(cyclic).hasRoots());
    }

    private static SourceTree pricing() {
        FunctionDef price = new FunctionDef("price", 2, 4, List.of("base"), List.of(), false, null,
                List.of(new Return(3, List.of("base"), true)));
        FunctionDef total = new FunctionDef("total", 5, 8, List.of(), List.of(), false, null,
                List.of(new Call("price", null, 6), new Return(7, List.of(), true)));
        return SourceTree.of(new TypeDef("Pricing", 1, 9, List.of(price, total)));
    }

    @Test
    void build_CalleeReturnsFeedCaller() {
        // Act
        CausalGraph graph = builder.build(pricing());

        // Assert
        assertTrue(graph.hasEdge("return:Pricing.price:L3", "func:Pricing.total"));
        assertFalse(graph.hasEdge("return:Pricing.total:L7", "func:Pricing.price"));
    }

    @Test
    void build_UsesSuppliedCallGraph() {
        // Arrange: total -> price reversed
        CallGraph calls = CallGraph.build(List.of(CallEdge.builder()
                .caller("func:Pricing.price")
                .callee("func:Pricing.total")
                .line(3)
                .build()));

        // Act
        CausalGraph graph = builder.build(pricing(), calls);

        // Assert
        assertTrue(graph.hasEdge("return:Pricing.total:L7", "func:Pricing.price"));
        assertFalse(graph.hasEdge("return:Pricing.price:L3", "func:Pricing.total"));
    }
}
