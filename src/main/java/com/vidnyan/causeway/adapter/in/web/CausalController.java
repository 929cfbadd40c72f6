package com.vidnyan.causeway.adapter.in.web;

import com.vidnyan.causeway.application.port.in.EnhanceCodeUseCase;
import com.vidnyan.causeway.application.port.in.EnhanceCodeUseCase.EnhanceRequest;
import com.vidnyan.causeway.application.port.in.QueryInterventionUseCase;
import com.vidnyan.causeway.application.port.out.SourceTreeParser;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.CausalException;
import com.vidnyan.causeway.domain.error.ErrorFamily;
import com.vidnyan.causeway.domain.graph.CausalEdge;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.intervention.Intervention;
import com.vidnyan.causeway.domain.intervention.InterventionResult;
import com.vidnyan.causeway.domain.intervention.InterventionSpec;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.model.CausalBundle;
import com.vidnyan.causeway.domain.model.EnhancementMode;
import com.vidnyan.causeway.domain.syntax.SourceTree;
import com.vidnyan.causeway.domain.trace.InputRange;
import com.vidnyan.causeway.domain.trace.Trace;
import com.vidnyan.causeway.intervention.InterventionParser;
import com.vidnyan.causeway.simulation.TraceCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for causal analysis of submitted source code.
 */
@Slf4j
@RestController
@RequestMapping("/api/causal")
@RequiredArgsConstructor
public class CausalController {

    private static final String DEFAULT_ORIGIN = "<request>";

    private final SourceTreeParser parser;
    private final EnhanceCodeUseCase enhanceCodeUseCase;
    private final QueryInterventionUseCase queryInterventionUseCase;
    private final InterventionParser interventionParser;
    private final TraceCollector traceCollector;
    private final CausalProperties properties;

    @PostMapping("/analyze")
    public AnalyzeResponse analyze(@RequestBody AnalyzeRequest request) {
        log.info("Received causal analysis request");
        log.info("  Origin: {}", request.originOrDefault());
        log.info("  Mode: {}", request.mode());

        CausalBundle bundle = enhance(request);
        return AnalyzeResponse.from(bundle);
    }

    @PostMapping("/query")
    public InterventionResult query(@RequestBody QueryRequest request) {
        log.info("Received intervention query for {}", request.analysis().originOrDefault());

        // 1. Build graph and fit the model
        CausalBundle bundle = enhance(request.analysis());

        // 2. Sample the interventional distribution
        return queryInterventionUseCase.query(bundle, request.intervention());
    }

    @PostMapping("/simulate")
    public Map<String, List<Double>> simulate(@RequestBody SimulateRequest request) {
        CausalProperties.Sampling sampling = properties.getSampling();
        int numSamples = request.numSamples() == null ? sampling.getNumSamples() : request.numSamples();
        Long seed = request.seed() == null ? sampling.getSeed() : request.seed();
        log.info("Received simulation request: {} edges, {} functions, {} samples",
                request.edges() == null ? 0 : request.edges().size(),
                request.functions() == null ? 0 : request.functions().size(), numSamples);

        CausalGraph.Builder builder = CausalGraph.builder();
        if (request.edges() != null) {
            for (List<String> edge : request.edges()) {
                if (edge.size() != 2) {
                    throw new IllegalArgumentException("Edge must be a [source, target] pair: " + edge);
                }
                builder.addEdge(CausalEdge.dataFlow(edge.get(0), edge.get(1)));
            }
        }
        Map<String, String> functions = request.functions() == null ? Map.of() : request.functions();
        functions.keySet().forEach(id -> builder.addNode(GraphNode.variable(id)));
        CausalGraph graph = builder.build();

        InputRange defaultRange = new InputRange(sampling.getInputMin(), sampling.getInputMax());
        Map<String, InputRange> ranges = new LinkedHashMap<>();
        graph.nodeIds().forEach(id -> ranges.put(id, defaultRange));
        if (request.ranges() != null) {
            request.ranges().forEach((name, bounds) -> {
                if (bounds.size() != 2) {
                    throw new IllegalArgumentException("Range must be a [min, max] pair: " + name);
                }
                ranges.put(name, new InputRange(bounds.get(0), bounds.get(1)));
            });
        }

        return traceCollector.collectFromSource(graph, functions, numSamples, ranges, seed).toLists();
    }

    @PostMapping("/interventions/parse")
    public ParsedIntervention parseIntervention(@RequestBody Object request) {
        InterventionSpec spec = interventionParser.parse(request);
        return new ParsedIntervention(spec, spec.interventions().stream().map(Intervention::describe).toList());
    }

    @GetMapping("/health")
    public String health() {
        return "OK - Causeway causal analysis";
    }

    @ExceptionHandler(CausalException.class)
    public ResponseEntity<ErrorResponse> handleCausalException(CausalException e) {
        HttpStatus status = e.family() == ErrorFamily.EXTERNAL_SERVICE ? HttpStatus.BAD_GATEWAY : HttpStatus.BAD_REQUEST;
        log.warn("Request failed ({}): {}", e.family(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.family().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    private CausalBundle enhance(AnalyzeRequest request) {
        if (request.code() == null || request.code().isBlank()) {
            throw new IllegalArgumentException("'code' is required");
        }
        SourceTree tree = parser.parseSource(request.originOrDefault(), request.code());
        EnhanceRequest enhanceRequest = EnhanceRequest.forTree(tree)
                .withMode(request.mode() == null ? EnhancementMode.AUTO : EnhancementMode.fromLabel(request.mode()));
        if (request.traces() != null && !request.traces().isEmpty()) {
            enhanceRequest = enhanceRequest.withTraces(Trace.fromLists(request.traces()));
        }
        return enhanceCodeUseCase.enhance(enhanceRequest);
    }

    public record AnalyzeRequest(
        String code,
        String origin,
        String mode,                        // static, dynamic or auto
        Map<String, List<Double>> traces    // one column per graph node
    ) {
        String originOrDefault() {
            return origin == null || origin.isBlank() ? DEFAULT_ORIGIN : origin;
        }
    }

    public record SimulateRequest(
        List<List<String>> edges,               // [source, target] pairs
        Map<String, String> functions,          // method source per node id
        Integer numSamples,
        Map<String, List<Double>> ranges,       // [min, max] per node or parameter name
        Long seed
    ) {}

    public record QueryRequest(AnalyzeRequest analysis, Object intervention) {}

    public record AnalyzeResponse(
        List<NodeView> nodes,
        List<EdgeView> edges,
        Map<String, Mechanism> mechanisms,
        String mode,
        List<String> warnings,
        Map<String, Object> metadata
    ) {
        static AnalyzeResponse from(CausalBundle bundle) {
            CausalGraph graph = bundle.causalGraph();
            List<NodeView> nodes = graph == null ? List.of() : graph.nodes().stream()
                    .map(n -> new NodeView(n.id(), n.name(), n.kind().name(), n.sourceLine(), n.scope()))
                    .toList();
            List<EdgeView> edges = graph == null ? List.of() : graph.edges().stream()
                    .map(e -> new EdgeView(e.source(), e.target(), e.kind().label()))
                    .toList();
            return new AnalyzeResponse(
                    nodes,
                    edges,
                    bundle.scm() == null ? Map.of() : bundle.scm().mechanisms(),
                    bundle.mode() == null ? null : bundle.mode().label(),
                    bundle.warnings(),
                    bundle.metadata());
        }
    }

    public record NodeView(String id, String name, String kind, int line, String scope) {}

    public record EdgeView(String source, String target, String kind) {}

    public record ParsedIntervention(InterventionSpec spec, List<String> descriptions) {}

    public record ErrorResponse(String family, String message) {}
}
