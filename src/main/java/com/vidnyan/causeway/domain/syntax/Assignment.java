package com.vidnyan.causeway.domain.syntax;

import java.util.List;

/**
 * Plain or augmented assignment to a simple name.
 *
 * @param reads     names read by the right-hand side, in order of appearance
 * @param operator  assignment operator ({@code =}, {@code +=}, {@code ++}, ...)
 * @param valueType syntactic category of the right-hand side
 */
public record Assignment(
    String target,
    int line,
    List<String> reads,
    boolean augmented,
    String operator,
    String valueType
) implements SyntaxNode {

    public Assignment {
        reads = List.copyOf(reads);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.ASSIGNMENT;
    }
}
