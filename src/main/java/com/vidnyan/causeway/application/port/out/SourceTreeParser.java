package com.vidnyan.causeway.application.port.out;

import com.vidnyan.causeway.domain.syntax.SourceTree;

import java.nio.file.Path;

/**
 * Port for turning source code into the lowered tree the causal pipeline consumes.
 * Implemented by adapters (e.g., JavaParser adapter).
 */
public interface SourceTreeParser {

    /**
     * Parse a single file, or every source file below a directory.
     *
     * @throws com.vidnyan.causeway.domain.error.GraphBuildException if nothing can be parsed
     */
    SourceTree parse(Path sourcePath);

    /**
     * Parse source text held in memory.
     *
     * @param origin label used in logs and errors
     */
    SourceTree parseSource(String origin, String code);
}
