package com.vidnyan.causeway.domain.syntax;

import java.util.List;

/**
 * An {@code if} statement. For an {@code else if}, {@code elseIf} is set and the
 * chained conditional is the last node of {@link #orElse()}; nodes before it are
 * calls and assignments evaluated by its test.
 *
 * @param elseRange null when there is no else branch
 */
public record Conditional(
    int line,
    List<String> conditionReads,
    LineRange bodyRange,
    List<SyntaxNode> body,
    LineRange elseRange,
    List<SyntaxNode> orElse,
    boolean elseIf
) implements SyntaxNode {

    public Conditional {
        conditionReads = List.copyOf(conditionReads);
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CONDITIONAL;
    }

    public boolean hasElse() {
        return elseRange != null;
    }

    /**
     * The chained {@code else if} conditional, or null.
     */
    public Conditional elseIfConditional() {
        if (!elseIf || orElse.isEmpty()) {
            return null;
        }
        SyntaxNode last = orElse.get(orElse.size() - 1);
        return last.kind() == SyntaxKind.CONDITIONAL ? (Conditional) last : null;
    }
}
