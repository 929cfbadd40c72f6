package com.vidnyan.causeway.mechanism;

import com.vidnyan.causeway.application.port.out.ScmService;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.DataException;
import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.error.ModelValidationException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.graph.NodeKind;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.model.FittedScm;
import com.vidnyan.causeway.domain.trace.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Fits a structural causal model to a graph, statically from source or dynamically from traces.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScmFitter {

    private final StaticMechanismInferrer inferrer;
    private final ScmService scmService;
    private final CausalProperties properties;

    /**
     * Static fitting runs when {@code staticOnly} is set, or when only source is supplied.
     *
     * @param traces       execution traces, one column per graph node; may be null
     * @param sourceByNode method source per node id; may be null
     * @throws DataException             if trace columns and graph nodes differ
     * @throws ModelValidationException  if the service reports a fit below the R² threshold
     * @throws FittingException          if the service reports an error, or nothing to fit from
     * @throws com.vidnyan.causeway.domain.error.ExternalServiceException if the service call fails
     */
    public FittedScm fit(CausalGraph graph, Trace traces, boolean staticOnly, Map<String, String> sourceByNode) {
        Map<String, String> sources = sourceByNode == null ? Map.of() : sourceByNode;
        if (staticOnly || (traces == null && !sources.isEmpty())) {
            return fitStatic(graph, sources);
        }
        if (traces != null) {
            return fitDynamic(graph, traces);
        }
        throw new FittingException("Must provide either traces or source code for fitting");
    }

    private FittedScm fitStatic(CausalGraph graph, Map<String, String> sources) {
        Map<String, Mechanism> mechanisms = new LinkedHashMap<>();
        for (GraphNode node : graph.nodes()) {
            String source = sources.get(node.id());
            if (source == null && node.kind() == NodeKind.FUNCTION && node.metadata().get("source") != null) {
                source = node.metadata().get("source").toString();
            }
            if (source == null) {
                continue;
            }
            try {
                mechanisms.put(node.id(), inferrer.infer(source));
            } catch (FittingException e) {
                log.warn("Skipping mechanism for {}: {}", node.id(), e.getMessage());
            }
        }
        log.info("Static SCM: {} mechanisms for {} nodes", mechanisms.size(), graph.nodeCount());
        return FittedScm.staticModel(mechanisms);
    }

    private FittedScm fitDynamic(CausalGraph graph, Trace traces) {
        Set<String> missingInTraces = new TreeSet<>(graph.nodeIds());
        missingInTraces.removeAll(traces.columnNames());
        Set<String> missingInGraph = new TreeSet<>(traces.columnNames());
        missingInGraph.removeAll(graph.nodeIds());
        if (!missingInTraces.isEmpty() || !missingInGraph.isEmpty()) {
            throw new DataException("Graph nodes and trace columns do not match.\n"
                    + "  Missing in traces: " + missingInTraces + "\n"
                    + "  Missing in graph: " + missingInGraph);
        }

        CausalProperties.Fitting fitting = properties.getFitting();
        ScmService.FitResponse response = scmService.fit(ScmService.FitRequest.of(graph, traces,
                new ScmService.FitConfig(fitting.getQuality(), true, fitting.getR2Threshold(), fitting.getTestSize())));

        Map<String, Object> validation = response.validation() == null ? Map.of() : response.validation();
        if (ScmService.STATUS_VALIDATION_FAILED.equals(response.status())) {
            double meanR2 = validation.get("mean_r2") instanceof Number n ? n.doubleValue() : 0.0;
            List<String> failedNodes = validation.get("failed_nodes") instanceof List<?> list
                    ? list.stream().map(String::valueOf).toList()
                    : List.of();
            throw new ModelValidationException(String.format(
                    "Model validation failed: mean R²=%.4f (threshold=%s)%nFailed nodes: %s",
                    meanR2, fitting.getR2Threshold(), failedNodes), meanR2, failedNodes);
        }
        if (ScmService.STATUS_ERROR.equals(response.status())) {
            throw new FittingException("SCM service error: "
                    + Objects.requireNonNullElse(response.error(), "Unknown error"));
        }

        log.info("Dynamic SCM fitted: status={}, mean R²={}", response.status(), validation.get("mean_r2"));
        return FittedScm.dynamicModel(response.scm(), validation, response.metadata(), response.status(), traces);
    }
}
