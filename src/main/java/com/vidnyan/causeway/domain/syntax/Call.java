package com.vidnyan.causeway.domain.syntax;

/**
 * Method invocation.
 *
 * @param receiver text of the receiver expression, or null for an unqualified call
 */
public record Call(String name, String receiver, int line) implements SyntaxNode {

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.CALL;
    }
}
