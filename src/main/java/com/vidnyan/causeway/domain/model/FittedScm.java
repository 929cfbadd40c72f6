package com.vidnyan.causeway.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.trace.Trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structural causal model ready for queries.
 * <p>
 * Static models carry one inferred mechanism per node. Dynamic models carry the
 * service's opaque payload, its validation report, and the traces they were fitted
 * on, which interventions need for resampling.
 */
public record FittedScm(
    ScmMode mode,
    Map<String, Mechanism> mechanisms,
    Map<String, Object> scm,
    Map<String, Object> validation,
    Map<String, Object> metadata,
    String status,
    @JsonIgnore Trace traces
) {

    public FittedScm {
        mechanisms = copy(mechanisms);
        scm = copy(scm);
        validation = copy(validation);
        metadata = copy(metadata);
    }

    public static FittedScm staticModel(Map<String, Mechanism> mechanisms) {
        return new FittedScm(ScmMode.STATIC, mechanisms, null, null, null, null, null);
    }

    public static FittedScm dynamicModel(Map<String, Object> scm, Map<String, Object> validation,
                                         Map<String, Object> metadata, String status, Trace traces) {
        return new FittedScm(ScmMode.DYNAMIC, null, scm, validation, metadata, status, traces);
    }

    @JsonIgnore
    public boolean hasTraces() {
        return traces != null && !traces.isEmpty();
    }

    private static <V> Map<String, V> copy(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
