package com.vidnyan.causeway.domain.mechanism;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MechanismKind {
    CONSTANT,
    LINEAR,
    NONLINEAR,
    CONDITIONAL,
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
