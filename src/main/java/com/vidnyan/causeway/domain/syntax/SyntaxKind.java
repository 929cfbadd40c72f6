package com.vidnyan.causeway.domain.syntax;

/**
 * Closed set of syntactic forms the causal analysis cares about.
 */
public enum SyntaxKind {
    TYPE,
    FUNCTION,
    ASSIGNMENT,
    CONDITIONAL,
    LOOP,
    EXCEPTION_BLOCK,
    CALL,
    RETURN
}
