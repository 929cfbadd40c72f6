package com.vidnyan.causeway.domain.intervention;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Interventions to apply together, which nodes to observe and how many samples to draw.
 *
 * @param queryNodes nodes to report, or {@code null} for all of them
 * @param numSamples defaults to {@value #DEFAULT_NUM_SAMPLES} when absent
 */
public record InterventionSpec(
    List<Intervention> interventions,
    @JsonProperty("query_nodes") List<String> queryNodes,
    @JsonProperty("num_samples") Integer numSamples
) {

    public static final int DEFAULT_NUM_SAMPLES = 1000;

    public InterventionSpec {
        interventions = interventions == null ? List.of() : List.copyOf(interventions);
        queryNodes = queryNodes == null ? null : List.copyOf(queryNodes);
        numSamples = numSamples == null ? DEFAULT_NUM_SAMPLES : numSamples;
    }

    public static InterventionSpec of(Intervention... interventions) {
        return new InterventionSpec(List.of(interventions), null, DEFAULT_NUM_SAMPLES);
    }

    public static InterventionSpec of(List<Intervention> interventions) {
        return new InterventionSpec(interventions, null, DEFAULT_NUM_SAMPLES);
    }
}
