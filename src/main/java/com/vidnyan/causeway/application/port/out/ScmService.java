package com.vidnyan.causeway.application.port.out;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.intervention.Intervention;
import com.vidnyan.causeway.domain.intervention.NodeStatistics;
import com.vidnyan.causeway.domain.trace.Trace;

import java.util.List;
import java.util.Map;

/**
 * Port for the external structural causal model service.
 * One synchronous request/response per call; implementations bound the wait.
 */
public interface ScmService {

    /**
     * Fit mechanisms for every node of the graph from the traces.
     *
     * @throws com.vidnyan.causeway.domain.error.ExternalServiceException on timeout,
     *         malformed output or an {@code error} status
     */
    FitResponse fit(FitRequest request);

    /**
     * Fit, then sample the interventional distribution.
     *
     * @throws com.vidnyan.causeway.domain.error.ExternalServiceException on timeout,
     *         malformed output or an {@code error} status
     */
    QueryResponse query(QueryRequest request);

    boolean isAvailable();

    String STATUS_SUCCESS = "success";
    String STATUS_VALIDATION_FAILED = "validation_failed";
    String STATUS_WARNING = "warning";
    String STATUS_ERROR = "error";

    /**
     * Graph wire shape: node ids and distinct {@code [source, target]} pairs.
     */
    record GraphPayload(List<String> nodes, List<List<String>> edges) {

        public static GraphPayload of(CausalGraph graph) {
            return new GraphPayload(
                    List.copyOf(graph.nodeIds()),
                    graph.edges().stream().map(e -> List.of(e.source(), e.target())).distinct().toList());
        }
    }

    record FitConfig(
        String quality,
        @JsonProperty("validate_r2") boolean validateR2,
        @JsonProperty("r2_threshold") double r2Threshold,
        @JsonProperty("test_size") double testSize
    ) {}

    record FitRequest(GraphPayload graph, Map<String, List<Double>> traces, FitConfig config) {

        public static FitRequest of(CausalGraph graph, Trace traces, FitConfig config) {
            return new FitRequest(GraphPayload.of(graph), traces.toLists(), config);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FitResponse(
        String status,
        Map<String, Object> scm,
        Map<String, Object> validation,
        Map<String, Object> metadata,
        String error,
        String traceback
    ) {}

    record QuerySpec(
        String type,
        List<Intervention> interventions,
        @JsonProperty("query_nodes") List<String> queryNodes,
        @JsonProperty("num_samples") int numSamples
    ) {

        public static QuerySpec interventional(List<Intervention> interventions, List<String> queryNodes,
                                               int numSamples) {
            return new QuerySpec("interventional", interventions, queryNodes, numSamples);
        }
    }

    record QueryRequest(
        GraphPayload graph,
        Map<String, List<Double>> traces,
        QuerySpec intervention,
        Map<String, Object> config
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QueryResponse(
        String status,
        Map<String, List<Double>> samples,
        Map<String, NodeStatistics> statistics,
        Map<String, Object> metadata,
        String error,
        String traceback
    ) {}
}
