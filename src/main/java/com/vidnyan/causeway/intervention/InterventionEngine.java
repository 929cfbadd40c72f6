package com.vidnyan.causeway.intervention;

import com.vidnyan.causeway.application.port.out.ScmService;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.ExternalServiceException;
import com.vidnyan.causeway.domain.error.InterventionException;
import com.vidnyan.causeway.domain.error.InterventionValidationException;
import com.vidnyan.causeway.domain.error.NodeNotFoundException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.intervention.Intervention;
import com.vidnyan.causeway.domain.intervention.InterventionResult;
import com.vidnyan.causeway.domain.intervention.InterventionSpec;
import com.vidnyan.causeway.domain.intervention.NodeStatistics;
import com.vidnyan.causeway.domain.model.FittedScm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Min;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs do-queries against a fitted model through the external SCM service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterventionEngine {

    private final InterventionParser parser;
    private final ScmService scmService;
    private final CausalProperties properties;

    public InterventionSpec parse(Object request) {
        return parser.parse(request);
    }

    /**
     * @throws NodeNotFoundException           if an intervened or queried node is not in the graph
     * @throws InterventionValidationException if the spec is empty or asks for no samples
     */
    public void validate(InterventionSpec spec, CausalGraph graph) {
        if (spec.interventions().isEmpty()) {
            throw new InterventionValidationException("Intervention spec has no interventions");
        }
        if (spec.numSamples() < 1) {
            throw new InterventionValidationException("num_samples must be >= 1, got " + spec.numSamples());
        }
        for (Intervention intervention : spec.interventions()) {
            if (!graph.containsNode(intervention.node())) {
                throw new NodeNotFoundException("Intervention", intervention.node(), graph.nodeIds());
            }
        }
        if (spec.queryNodes() != null) {
            for (String queryNode : spec.queryNodes()) {
                if (!graph.containsNode(queryNode)) {
                    throw new NodeNotFoundException("Query", queryNode, graph.nodeIds());
                }
            }
        }
    }

    /**
     * Parse, validate, then sample the interventional distribution.
     *
     * @param request anything {@link InterventionParser#parse} accepts
     * @throws InterventionException if the model has no traces or the query fails
     */
    public InterventionResult execute(FittedScm scm, Object request, CausalGraph graph) {
        InterventionSpec spec = parse(request);
        validate(spec, graph);

        if (scm == null || !scm.hasTraces()) {
            throw new InterventionException("The fitted model must carry execution traces for intervention queries; "
                    + "fit it in dynamic mode");
        }

        log.info("Executing intervention: {}", spec.interventions().stream().map(Intervention::describe).toList());
        ScmService.QueryRequest query = new ScmService.QueryRequest(
                ScmService.GraphPayload.of(graph),
                scm.traces().toLists(),
                ScmService.QuerySpec.interventional(spec.interventions(), spec.queryNodes(), spec.numSamples()),
                Map.of("quality", properties.getFitting().getQuality()));

        ScmService.QueryResponse response;
        try {
            response = scmService.query(query);
        } catch (ExternalServiceException e) {
            throw new InterventionException("Intervention query failed: " + e.getMessage(), e);
        }

        if (!ScmService.STATUS_SUCCESS.equals(response.status())) {
            throw new InterventionException("Intervention query failed: "
                    + (response.error() != null ? response.error() : "status " + response.status()));
        }
        if (response.samples() == null) {
            throw new InterventionException("Intervention query returned no samples");
        }

        Map<String, NodeStatistics> statistics = new LinkedHashMap<>();
        response.samples().forEach((node, values) -> {
            NodeStatistics reported = response.statistics() == null ? null : response.statistics().get(node);
            statistics.put(node, reported != null ? reported : summarize(values));
        });
        return new InterventionResult(response.samples(), statistics, response.metadata(), spec);
    }

    /**
     * Mean, population standard deviation, linear-interpolated 5/50/95% quantiles, min and max.
     */
    static NodeStatistics summarize(List<Double> samples) {
        double[] values = samples.stream().mapToDouble(Double::doubleValue).toArray();
        if (values.length == 0) {
            return new NodeStatistics(Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                    Double.NaN);
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        return new NodeStatistics(
                new Mean().evaluate(values),
                new StandardDeviation(false).evaluate(values),
                percentile.evaluate(5),
                percentile.evaluate(50),
                percentile.evaluate(95),
                new Min().evaluate(values),
                new Max().evaluate(values));
    }
}
