package com.vidnyan.causeway.domain.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowered source of one compilation unit (or a set of them).
 */
public record SourceTree(String origin, List<SyntaxNode> roots) {

    public SourceTree {
        roots = List.copyOf(roots);
    }

    public static SourceTree of(SyntaxNode... roots) {
        return new SourceTree("<memory>", List.of(roots));
    }

    /**
     * Merge several trees into one, keeping root order.
     */
    public static SourceTree merge(String origin, List<SourceTree> trees) {
        List<SyntaxNode> roots = new ArrayList<>();
        trees.forEach(t -> roots.addAll(t.roots()));
        return new SourceTree(origin, roots);
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }
}
