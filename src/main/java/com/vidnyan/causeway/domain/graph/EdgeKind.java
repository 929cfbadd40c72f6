package com.vidnyan.causeway.domain.graph;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeKind {
    DATA_FLOW("data_flow"),
    CONTROL_FLOW("control_flow");

    private final String label;

    EdgeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
