package com.vidnyan.causeway.domain.syntax;

import java.util.List;

/**
 * Class, interface, enum or record declaration. Opens a scope.
 */
public record TypeDef(String name, int line, int endLine, List<SyntaxNode> body) implements SyntaxNode {

    public TypeDef {
        body = List.copyOf(body);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.TYPE;
    }
}
