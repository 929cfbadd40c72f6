package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.graph.CausalEdge;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.EdgeKind;
import com.vidnyan.causeway.domain.syntax.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowExtractorTest {

    private final CausalGraphBuilder builder = CausalGraphBuilder.withDefaults();

    private static Assignment assign(String target, int line, String... reads) {
        return new Assignment(target, line, List.of(reads), false, "=", null);
    }

    private static FunctionDef function(String name, SyntaxNode... body) {
        return new FunctionDef(name, 1, 20, List.of(), List.of(), false, null, List.of(body));
    }

    private static Conditional conditional(int line, List<String> reads, LineRange bodyRange, List<SyntaxNode> body,
                                           LineRange elseRange, List<SyntaxNode> orElse, boolean elseIf) {
        return new Conditional(line, reads, bodyRange, body, elseRange, orElse, elseIf);
    }

    private static boolean hasControlEdge(CausalGraph graph, String source, String target) {
        return graph.edges().contains(CausalEdge.controlFlow(source, target));
    }

    private static String var(String scope, String name, int line) {
        return "var:" + scope + "." + name + ":L" + line;
    }

    @Test
    void conditional_LinksConditionToBothBranches() {
        // Arrange
        SourceTree tree = SourceTree.of(function("f",
                assign("a", 2),
                conditional(3, List.of("a"),
                        new LineRange(4, 4), List.of(assign("b", 4)),
                        new LineRange(6, 6), List.of(assign("c", 6)), false)));

        // Act
        CausalGraph graph = builder.build(tree);

        // Assert
        assertTrue(hasControlEdge(graph, var("f", "a", 2), var("f", "b", 4)));
        assertTrue(hasControlEdge(graph, var("f", "a", 2), var("f", "c", 6)));
        assertFalse(hasControlEdge(graph, var("f", "b", 4), var("f", "c", 6)));
    }

    @Test
    void conditional_ElseIfLinksFirstBodyNodeToFirstAlternativeCondition() {
        // Arrange
        Conditional alternative = conditional(6, List.of("b", "a"),
                new LineRange(7, 7), List.of(assign("d", 7)),
                null, List.of(), false);
        SourceTree tree = SourceTree.of(function("f",
                assign("a", 2),
                assign("b", 3),
                conditional(4, List.of("a"),
                        new LineRange(5, 5), List.of(assign("c", 5)),
                        new LineRange(6, 8), List.of(alternative), true)));

        // Act
        CausalGraph graph = builder.build(tree);

        // Assert
        assertTrue(hasControlEdge(graph, var("f", "a", 2), var("f", "c", 5)));
        assertTrue(hasControlEdge(graph, var("f", "c", 5), var("f", "b", 3)));
        assertFalse(hasControlEdge(graph, var("f", "c", 5), var("f", "a", 2)),
                "only the first condition of the alternative is linked");
        assertTrue(hasControlEdge(graph, var("f", "b", 3), var("f", "d", 7)));
        assertTrue(hasControlEdge(graph, var("f", "a", 2), var("f", "d", 7)));
    }

    @Test
    void conditional_WithoutConditionVariableLinksNearestPrecedingNode() {
        // if (isReady()) { q = 1; w = 2; }
        SourceTree tree = SourceTree.of(function("f",
                assign("p", 2),
                conditional(3, List.of(),
                        new LineRange(4, 5), List.of(assign("q", 4), assign("w", 5)),
                        null, List.of(), false)));

        CausalGraph graph = builder.build(tree);

        assertTrue(hasControlEdge(graph, var("f", "p", 2), var("f", "q", 4)));
        assertFalse(hasControlEdge(graph, var("f", "p", 2), var("f", "w", 5)));
        assertFalse(hasControlEdge(graph, var("f", "q", 4), var("f", "w", 5)));
    }

    @Test
    void conditional_WithoutAnyPrecedingNodeChainsBody() {
        SourceTree tree = SourceTree.of(function("f",
                conditional(2, List.of(),
                        new LineRange(3, 4), List.of(assign("q", 3), assign("w", 4)),
                        null, List.of(), false)));

        CausalGraph graph = builder.build(tree);

        assertTrue(hasControlEdge(graph, var("f", "q", 3), var("f", "w", 4)));
    }

    @Test
    void loop_LinksConditionToBody() {
        // Arrange
        SourceTree tree = SourceTree.of(function("f",
                assign("n", 2),
                new Loop(Loop.LoopKind.WHILE, 3, List.of("n"),
                        new LineRange(4, 5), List.of(assign("s", 4), assign("n", 5, "n")),
                        null, List.of())));

        // Act
        CausalGraph graph = builder.build(tree);

        // Assert
        assertTrue(hasControlEdge(graph, var("f", "n", 2), var("f", "s", 4)));
        assertTrue(hasControlEdge(graph, var("f", "n", 2), var("f", "n", 5)));
    }

    @Test
    void loop_ForHeaderAssignmentControlsBody() {
        SourceTree tree = SourceTree.of(function("f",
                assign("i", 3),
                new Loop(Loop.LoopKind.FOR, 3, List.of(),
                        new LineRange(4, 4), List.of(assign("t", 4)),
                        null, List.of())));

        CausalGraph graph = builder.build(tree);

        assertTrue(hasControlEdge(graph, var("f", "i", 3), var("f", "t", 4)));
    }

    @Test
    void exceptionBlock_LinksTryToHandlersAndFinally() {
        // Arrange
        ExceptionBlock.Handler handler = new ExceptionBlock.Handler("Exception", 4,
                new LineRange(5, 5), List.of(assign("r", 5)));
        SourceTree tree = SourceTree.of(function("f",
                new ExceptionBlock(2,
                        new LineRange(3, 3), List.of(assign("r", 3)),
                        List.of(handler),
                        null, List.of(),
                        new LineRange(7, 7), List.of(assign("done", 7)))));

        // Act
        CausalGraph graph = builder.build(tree);

        // Assert
        assertTrue(hasControlEdge(graph, var("f", "r", 3), var("f", "r", 5)));
        assertTrue(hasControlEdge(graph, var("f", "r", 3), var("f", "done", 7)));
        assertTrue(hasControlEdge(graph, var("f", "r", 5), var("f", "done", 7)));
    }

    @Test
    void mergedTrees_DoNotShareControlFlowAcrossFiles() {
        // Arrange: both files use lines 3-5
        SourceTree first = new SourceTree("A.java", List.of(new TypeDef("A", 1, 8, List.of(function("f",
                assign("a", 3),
                conditional(4, List.of("a"),
                        new LineRange(5, 5), List.of(assign("a", 5)),
                        null, List.of(), false))))));
        SourceTree second = new SourceTree("B.java", List.of(new TypeDef("B", 1, 8, List.of(function("g",
                assign("q", 3),
                assign("r", 5, "q"))))));

        // Act
        CausalGraph graph = builder.build(SourceTree.merge("src", List.of(first, second)));

        // Assert
        assertTrue(hasControlEdge(graph, var("A.f", "a", 3), var("A.f", "a", 5)));
        assertTrue(graph.hasEdge(var("B.g", "q", 3), var("B.g", "r", 5)));
        List<CausalEdge> crossing = graph.edges().stream()
                .filter(e -> e.kind() == EdgeKind.CONTROL_FLOW)
                .filter(e -> e.source().startsWith("var:B.") || e.target().startsWith("var:B."))
                .toList();
        assertEquals(List.of(), crossing);
    }
}
