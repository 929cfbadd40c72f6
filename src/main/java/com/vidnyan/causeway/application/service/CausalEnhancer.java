package com.vidnyan.causeway.application.service;

import com.vidnyan.causeway.analysis.CausalGraphBuilder;
import com.vidnyan.causeway.application.port.in.EnhanceCodeUseCase;
import com.vidnyan.causeway.application.port.in.QueryInterventionUseCase;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.CausalException;
import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.error.GraphBuildException;
import com.vidnyan.causeway.domain.error.InterventionException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.intervention.InterventionResult;
import com.vidnyan.causeway.domain.model.CausalBundle;
import com.vidnyan.causeway.domain.model.FittedScm;
import com.vidnyan.causeway.domain.model.ScmMode;
import com.vidnyan.causeway.intervention.InterventionEngine;
import com.vidnyan.causeway.mechanism.ScmFitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orchestrates graph construction, mechanism fitting and intervention queries.
 * <p>
 * Enhancement degrades instead of throwing: every failure becomes a warning tag on the
 * returned bundle. Failures of the external service and unexpected errors count toward
 * a circuit breaker; once it opens, enhancement short-circuits until
 * {@link #resetCircuitBreaker()}. A fully successful run clears the count.
 * Counter and flag are guarded by this instance's monitor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CausalEnhancer implements EnhanceCodeUseCase, QueryInterventionUseCase {

    public static final String WARNING_CIRCUIT_BREAKER = "causal_unavailable_circuit_breaker";
    public static final String WARNING_GRAPH_FAILED = "graph_extraction_failed";
    public static final String WARNING_FITTING_FAILED = "scm_fitting_failed";
    public static final String WARNING_SERVICE_FAILED = "scm_service_failed";
    public static final String WARNING_ENHANCEMENT_FAILED = "causal_enhancement_failed";

    private final CausalGraphBuilder graphBuilder;
    private final ScmFitter scmFitter;
    private final InterventionEngine interventionEngine;
    private final CausalProperties properties;

    private int consecutiveFailures;
    private boolean circuitOpen;

    @Override
    public CausalBundle enhance(EnhanceRequest request) {
        Instant startTime = Instant.now();
        List<String> warnings = new ArrayList<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("requested_mode", request.mode().name().toLowerCase(Locale.ROOT));

        if (isCircuitOpen()) {
            log.warn("Circuit breaker open: causal analysis unavailable (failures: {})", consecutiveFailures());
            warnings.add(WARNING_CIRCUIT_BREAKER);
            return CausalBundle.degraded(warnings, metadata);
        }

        ScmMode mode = request.mode().resolve(request.traces() != null);
        metadata.put("mode", mode.label());
        log.info("Starting causal enhancement of {} (mode={})", request.sourceTree().origin(), mode.label());

        try {
            // Step 1: Build causal graph
            log.info("Step 1: Extracting causal graph...");
            CausalGraph graph;
            try {
                graph = graphBuilder.build(request.sourceTree(), request.callGraph());
            } catch (GraphBuildException e) {
                log.warn("Graph extraction failed: {}", e.getMessage());
                warnings.add(WARNING_GRAPH_FAILED);
                return CausalBundle.degraded(warnings, metadata);
            }
            metadata.put("node_count", graph.nodeCount());
            metadata.put("edge_count", graph.edgeCount());

            // Step 2: Fit mechanisms
            log.info("Step 2: Fitting SCM (mode={})...", mode.label());
            FittedScm scm;
            try {
                scm = fit(graph, request, mode);
            } catch (CausalException e) {
                return partial(graph, mode, e, warnings, metadata);
            }

            recordSuccess();
            metadata.put("duration_ms", Duration.between(startTime, Instant.now()).toMillis());
            log.info("Causal enhancement complete: {} nodes, {} mechanisms in {}ms",
                    graph.nodeCount(), scm.mechanisms().size(), metadata.get("duration_ms"));
            return new CausalBundle(graph, scm, mode, warnings, metadata);
        } catch (RuntimeException e) {
            log.error("Causal enhancement failed unexpectedly: {}", e.getMessage(), e);
            recordFailure();
            warnings.add(WARNING_ENHANCEMENT_FAILED);
            return CausalBundle.degraded(warnings, metadata);
        }
    }

    private FittedScm fit(CausalGraph graph, EnhanceRequest request, ScmMode mode) {
        if (mode == ScmMode.STATIC) {
            return scmFitter.fit(graph, null, true, request.sourceByNode());
        }
        if (request.traces() == null) {
            throw new FittingException("Dynamic mode requires execution traces");
        }
        return scmFitter.fit(graph, request.traces(), false, null);
    }

    private CausalBundle partial(CausalGraph graph, ScmMode mode, CausalException failure,
                                 List<String> warnings, Map<String, Object> metadata) {
        metadata.put("error_family", failure.family().name());
        metadata.put("error", failure.getMessage());
        switch (failure.family()) {
            case EXTERNAL_SERVICE:
                log.warn("SCM service failed: {}", failure.getMessage());
                recordFailure();
                warnings.add(WARNING_SERVICE_FAILED);
                break;
            case FITTING:
            case TRACE_COLLECTION:
            case GRAPH_CONSTRUCTION:
            case INTERVENTION:
                log.warn("SCM fitting failed: {}", failure.getMessage());
                warnings.add(WARNING_FITTING_FAILED);
                break;
        }
        return new CausalBundle(graph, null, mode, warnings, metadata);
    }

    @Override
    public InterventionResult query(CausalBundle bundle, Object request) {
        if (bundle == null || !bundle.hasCausalCapability()) {
            throw new InterventionException("No fitted causal model available; warnings: "
                    + (bundle == null ? List.of() : bundle.warnings()));
        }
        return interventionEngine.execute(bundle.scm(), request, bundle.causalGraph());
    }

    public synchronized void resetCircuitBreaker() {
        consecutiveFailures = 0;
        circuitOpen = false;
        log.info("Circuit breaker reset");
    }

    public synchronized boolean isCircuitOpen() {
        return properties.getCircuitBreaker().isEnabled() && circuitOpen;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    private synchronized void recordFailure() {
        if (!properties.getCircuitBreaker().isEnabled()) {
            return;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= properties.getCircuitBreaker().getThreshold() && !circuitOpen) {
            circuitOpen = true;
            log.error("Circuit breaker opened after {} failures", consecutiveFailures);
        }
    }

    private synchronized void recordSuccess() {
        consecutiveFailures = 0;
    }
}
