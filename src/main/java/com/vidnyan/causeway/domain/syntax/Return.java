package com.vidnyan.causeway.domain.syntax;

import java.util.List;

public record Return(int line, List<String> reads, boolean hasValue) implements SyntaxNode {

    public Return {
        reads = List.copyOf(reads);
    }

    @Override
    public SyntaxKind kind() {
        return SyntaxKind.RETURN;
    }
}
