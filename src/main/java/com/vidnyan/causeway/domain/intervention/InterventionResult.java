package com.vidnyan.causeway.domain.intervention;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Samples drawn from the interventional distribution, with the request that produced them.
 */
public record InterventionResult(
    Map<String, List<Double>> samples,
    Map<String, NodeStatistics> statistics,
    Map<String, Object> metadata,
    @JsonProperty("intervention_spec") InterventionSpec interventionSpec
) {

    public InterventionResult {
        samples = Collections.unmodifiableMap(new LinkedHashMap<>(samples));
        statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
