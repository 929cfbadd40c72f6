package com.vidnyan.causeway.domain.syntax;

import java.util.List;

/**
 * A {@code try} statement with its handlers.
 *
 * @param elseRange    null unless there is a normal-completion clause
 * @param finallyRange null unless there is a finally clause
 */
public record ExceptionBlock(
    int line,
    LineRange bodyRange,
    List<SyntaxNode> body,
    List<Handler> handlers,
    LineRange elseRange,
    List<SyntaxNode> orElse,
    LineRange finallyRange,
    List<SyntaxNode> finallyBody
) implements SyntaxNode {

    public ExceptionBlock {
        body = List.copyOf(body);
        handlers = List.copyOf(handlers);
        orElse = List.copyOf(orElse);
        finallyBody = List.copyOf(finallyBody);
    }

    /**
     * A catch clause.
     */
    public record Handler(String exceptionType, int line, LineRange range, List<SyntaxNode> body) {

        public Handler {
            body = List.copyOf(body);
        }
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.EXCEPTION_BLOCK;
    }
}
