package com.vidnyan.causeway.domain.syntax;

/**
 * A node of the lowered source tree.
 * Consumers switch on {@link #kind()} and cast to the matching record.
 */
public interface SyntaxNode {

    SyntaxKind kind();

    int line();
}
