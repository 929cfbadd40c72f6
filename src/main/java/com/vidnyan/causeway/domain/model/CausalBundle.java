package com.vidnyan.causeway.domain.model;

import com.vidnyan.causeway.domain.graph.CausalGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a causal enhancement. A degraded bundle has no graph and explains why in
 * {@code warnings}; a partial one has a graph but no model.
 *
 * @param mode resolved fitting mode, or null when degraded
 */
public record CausalBundle(
    CausalGraph causalGraph,
    FittedScm scm,
    ScmMode mode,
    List<String> warnings,
    Map<String, Object> metadata
) {

    public CausalBundle {
        warnings = List.copyOf(warnings);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CausalBundle degraded(List<String> warnings, Map<String, Object> metadata) {
        return new CausalBundle(null, null, null, warnings, metadata);
    }

    public boolean hasCausalCapability() {
        return causalGraph != null && scm != null;
    }

    public boolean hasGraph() {
        return causalGraph != null;
    }
}
