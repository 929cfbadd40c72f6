package com.vidnyan.causeway.domain.syntax;

import java.util.List;

/**
 * A loop. {@link #controlReads()} are the names in the loop condition or iterable.
 *
 * @param elseRange null unless the loop has an else clause
 */
public record Loop(
    LoopKind loopKind,
    int line,
    List<String> controlReads,
    LineRange bodyRange,
    List<SyntaxNode> body,
    LineRange elseRange,
    List<SyntaxNode> orElse
) implements SyntaxNode {

    public Loop {
        controlReads = List.copyOf(controlReads);
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    public enum LoopKind {
        WHILE,
        DO_WHILE,
        FOR,
        FOR_EACH
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.LOOP;
    }

    /**
     * Iterating loops link the header line itself into the body.
     */
    public boolean iterates() {
        return loopKind == LoopKind.FOR || loopKind == LoopKind.FOR_EACH;
    }

    public boolean hasElse() {
        return elseRange != null;
    }
}
