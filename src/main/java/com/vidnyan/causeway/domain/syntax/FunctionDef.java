package com.vidnyan.causeway.domain.syntax;

import java.util.List;

/**
 * Method or constructor declaration. Opens a scope.
 *
 * @param decorators annotation text as written
 * @param source     full declaration text, used for static mechanism inference
 */
public record FunctionDef(
    String name,
    int line,
    int endLine,
    List<String> parameters,
    List<String> decorators,
    boolean async,
    String source,
    List<SyntaxNode> body
) implements SyntaxNode {

    public FunctionDef {
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
        body = List.copyOf(body);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.FUNCTION;
    }
}
