package com.vidnyan.causeway.adapter.out.parser;

import com.vidnyan.causeway.analysis.CausalGraphBuilder;
import com.vidnyan.causeway.domain.error.GraphBuildException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.NodeKind;
import com.vidnyan.causeway.domain.syntax.FunctionDef;
import com.vidnyan.causeway.domain.syntax.SourceTree;
import com.vidnyan.causeway.domain.syntax.SyntaxKind;
import com.vidnyan.causeway.domain.syntax.TypeDef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JavaSourceParserTest {

    private static final String CALCULATOR = """
            class Calc {
                int compute(int a) {
                    int b = a * 2;
                    int c = b + 1;
                    System.out.println(c);
                    return c;
                }
            }
            """;

    @TempDir
    Path tempDir;

    private final JavaSourceParser parser = new JavaSourceParser();

    @Test
    void parseSource_LowersMethodsIntoFunctionDefs() {
        SourceTree tree = parser.parseSource("Calc.java", CALCULATOR);

        assertEquals(1, tree.roots().size());
        TypeDef type = (TypeDef) tree.roots().get(0);
        assertEquals("Calc", type.name());
        FunctionDef compute = (FunctionDef) type.body().get(0);
        assertEquals(SyntaxKind.FUNCTION, compute.kind());
        assertEquals("compute", compute.name());
        assertEquals(2, compute.line());
        assertTrue(compute.source().contains("return c;"));
    }

    @Test
    void parseSource_FeedsGraphBuilder() {
        // Arrange
        SourceTree tree = parser.parseSource("Calc.java", CALCULATOR);

        // Act
        CausalGraph graph = CausalGraphBuilder.withDefaults().build(tree);

        // Assert
        assertTrue(graph.containsNode("func:Calc.compute"));
        assertTrue(graph.hasEdge("var:Calc.compute.b:L3", "var:Calc.compute.c:L4"));
        assertTrue(graph.hasEdge("var:Calc.compute.c:L4", "return:Calc.compute:L6"));
        assertTrue(graph.nodes().stream().noneMatch(n -> n.kind() == NodeKind.EFFECT),
                "println is not causal and must be pruned");
    }

    @Test
    void parseSource_RejectsBrokenCode() {
        assertThrows(GraphBuildException.class, () -> parser.parseSource("Broken.java", "class Broken {"));
    }

    @Test
    void parse_SkipsUnparseableFilesInDirectory() throws IOException {
        Path pkg = tempDir.resolve("com/example");
        Files.createDirectories(pkg);
        Files.writeString(pkg.resolve("Calc.java"), CALCULATOR);
        Files.writeString(pkg.resolve("Broken.java"), "class Broken {");
        Files.writeString(pkg.resolve("notes.txt"), "not java");

        SourceTree tree = parser.parse(tempDir);

        assertEquals(1, tree.roots().size());
    }

    @Test
    void parse_FailsWhenNothingParses() throws IOException {
        Files.writeString(tempDir.resolve("Broken.java"), "class Broken {");

        assertThrows(GraphBuildException.class, () -> parser.parse(tempDir));
    }
}
