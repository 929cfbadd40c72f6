package com.vidnyan.causeway.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.vidnyan.causeway.application.port.out.SourceTreeParser;
import com.vidnyan.causeway.domain.error.GraphBuildException;
import com.vidnyan.causeway.domain.syntax.SourceTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JavaParser adapter: parses Java sources and lowers each compilation unit
 * into a {@link SourceTree}.
 */
@Slf4j
@Component
public class JavaSourceParser implements SourceTreeParser {

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    @Override
    public SourceTree parse(Path sourcePath) {
        long startTime = System.currentTimeMillis();
        List<Path> javaFiles = collectJavaFiles(sourcePath);
        log.info("Parsing {} Java files from: {}", javaFiles.size(), sourcePath);

        List<SourceTree> trees = new ArrayList<>();
        for (Path file : javaFiles) {
            try {
                trees.add(parseSource(file.toString(), Files.readString(file)));
            } catch (IOException | GraphBuildException e) {
                log.warn("Failed to parse {}: {}", file, e.getMessage());
            }
        }

        if (trees.isEmpty()) {
            throw new GraphBuildException("No parseable Java sources under " + sourcePath);
        }

        log.info("Parsing complete: {} of {} files in {}ms",
                trees.size(), javaFiles.size(), System.currentTimeMillis() - startTime);
        return trees.size() == 1 ? trees.get(0) : SourceTree.merge(sourcePath.toString(), trees);
    }

    @Override
    public SourceTree parseSource(String origin, String code) {
        ParseResult<CompilationUnit> result;
        synchronized (parser) {
            result = parser.parse(code);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(p -> p.getVerboseMessage())
                    .collect(Collectors.joining("; "));
            throw new GraphBuildException("Cannot parse " + origin + ": " + problems);
        }
        return new SourceTree(origin, JavaSyntaxLowering.lower(result.getResult().get()));
    }

    private List<Path> collectJavaFiles(Path sourcePath) {
        if (Files.isRegularFile(sourcePath)) {
            return List.of(sourcePath);
        }
        try (Stream<Path> paths = Files.walk(sourcePath)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".java"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new GraphBuildException("Failed to list sources under " + sourcePath, e);
        }
    }
}
