package com.vidnyan.causeway.domain.graph;

public enum NodeKind {
    FUNCTION,
    VARIABLE,
    RETURN,
    EFFECT
}
