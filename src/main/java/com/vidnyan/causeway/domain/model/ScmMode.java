package com.vidnyan.causeway.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How mechanisms were obtained: inferred from source, or fitted from traces.
 */
public enum ScmMode {
    STATIC,
    DYNAMIC;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
