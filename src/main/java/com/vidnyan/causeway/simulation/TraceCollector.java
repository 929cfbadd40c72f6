package com.vidnyan.causeway.simulation;

import com.vidnyan.causeway.domain.error.CyclicGraphException;
import com.vidnyan.causeway.domain.error.InputGenerationException;
import com.vidnyan.causeway.domain.error.TraceCollectionException;
import com.vidnyan.causeway.domain.error.TraceExecutionException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.trace.InputRange;
import com.vidnyan.causeway.domain.trace.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Runs node functions over a causal DAG to produce execution traces.
 * <p>
 * Each trial walks the graph in topological order. Nodes without a function are
 * free inputs sampled uniformly from their range; other nodes receive, for each
 * declared parameter, the value already computed in this trial under that name,
 * or a fresh random draw when none exists. A trial that throws is recorded as a
 * failed row and dropped at the end.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TraceCollector {

    private static final double MAX_FAILURE_RATIO = 0.5;

    private final SourceFunctionCompiler compiler;

    public static TraceCollector withDefaults() {
        return new TraceCollector(new SourceFunctionCompiler());
    }

    /**
     * Compile each node's method source, then collect.
     *
     * @throws TraceCollectionException if any source fails to compile
     */
    public Trace collectFromSource(CausalGraph graph, Map<String, String> sourceByNode, int numSamples,
                                   Map<String, InputRange> inputRanges, Long seed) {
        log.info("Compiling {} functions...", sourceByNode.size());
        Map<String, NodeFunction> functions = new LinkedHashMap<>();
        sourceByNode.forEach((nodeId, source) -> functions.put(nodeId, compiler.compile(nodeId, source)));
        return collect(graph, functions, numSamples, inputRanges, seed);
    }

    /**
     * @param inputRanges per node or parameter name; {@link InputRange#DEFAULT} otherwise
     * @param seed        fixes the random draws; {@code null} for an unseeded run
     * @return one column per graph node in topological order, no missing values
     * @throws TraceCollectionException if the graph is cyclic or {@code numSamples < 1}
     * @throws TraceExecutionException  if more than half of the trials fail
     */
    public Trace collect(CausalGraph graph, Map<String, NodeFunction> functions, int numSamples,
                         Map<String, InputRange> inputRanges, Long seed) {
        List<String> order;
        try {
            order = graph.topologicalOrder();
        } catch (CyclicGraphException e) {
            throw new TraceCollectionException("Causal graph must be a DAG: " + e.getMessage(), e);
        }
        if (numSamples < 1) {
            throw new TraceCollectionException("numSamples must be >= 1, got " + numSamples);
        }
        for (Map.Entry<String, NodeFunction> entry : functions.entrySet()) {
            if (entry.getValue().isAsync()) {
                throw new TraceCollectionException(
                        "Async functions are not supported for trace collection: " + entry.getKey());
            }
        }
        if (order.isEmpty()) {
            log.info("Empty graph, returning empty trace");
            return Trace.empty();
        }

        Map<String, InputRange> ranges = inputRanges == null ? Map.of() : inputRanges;
        RandomGenerator random = seed == null ? new Well19937c() : new Well19937c(seed);
        log.info("Collecting {} samples for {} nodes...", numSamples, order.size());

        Map<String, double[]> columns = new LinkedHashMap<>();
        order.forEach(nodeId -> columns.put(nodeId, new double[numSamples]));

        int failed = 0;
        for (int sample = 0; sample < numSamples; sample++) {
            try {
                Map<String, Double> values = runTrial(order, graph, functions, ranges, random);
                for (String nodeId : order) {
                    columns.get(nodeId)[sample] = values.get(nodeId);
                }
            } catch (Exception e) {
                log.warn("Sample {} failed: {}", sample, e.getMessage());
                failed++;
                for (String nodeId : order) {
                    columns.get(nodeId)[sample] = Double.NaN;
                }
                if (failed > numSamples * MAX_FAILURE_RATIO) {
                    throw new TraceExecutionException("Too many failed samples: " + failed + "/" + numSamples);
                }
            }
        }
        log.info("Collection complete: {} successful, {} failed", numSamples - failed, failed);

        Trace trace = Trace.of(columns).dropIncompleteRows();
        if (trace.rowCount() < numSamples * MAX_FAILURE_RATIO) {
            throw new TraceExecutionException("Too few successful samples: "
                    + trace.rowCount() + "/" + numSamples);
        }
        return trace;
    }

    private Map<String, Double> runTrial(List<String> order, CausalGraph graph, Map<String, NodeFunction> functions,
                                         Map<String, InputRange> ranges, RandomGenerator random) throws Exception {
        Map<String, Double> values = new HashMap<>();
        for (String nodeId : order) {
            NodeFunction function = functions.get(nodeId);
            if (function == null) {
                values.put(nodeId, uniform(random, ranges.getOrDefault(nodeId, InputRange.DEFAULT)));
                continue;
            }

            Set<String> predecessors = graph.predecessors(nodeId);
            List<String> parameters = function.parameters();
            double[] arguments = new double[parameters.size()];
            for (int i = 0; i < arguments.length; i++) {
                String parameter = parameters.get(i);
                Double value = predecessors.contains(parameter) ? values.get(parameter) : null;
                if (value == null) {
                    value = values.get(parameter);
                }
                if (value == null) {
                    value = uniform(random, ranges.getOrDefault(parameter, InputRange.DEFAULT));
                }
                arguments[i] = value;
            }

            double result;
            try {
                result = function.invoke(arguments);
            } catch (Exception e) {
                throw new TraceExecutionException("Failed to execute " + nodeId + " with args "
                        + Arrays.toString(arguments) + ": " + e.getMessage(), e);
            }
            values.put(nodeId, result);
        }
        return values;
    }

    /**
     * Sample free inputs only.
     *
     * @param nodes nodes to sample; all roots of the graph when {@code null}
     * @throws InputGenerationException for a non-positive sample count or an unknown node
     */
    public Trace generateRandomInputs(CausalGraph graph, Collection<String> nodes, int numSamples,
                                      Map<String, InputRange> inputRanges, Long seed) {
        if (numSamples < 1) {
            throw new InputGenerationException("numSamples must be >= 1, got " + numSamples);
        }
        Collection<String> targets = nodes == null ? graph.roots() : nodes;
        Map<String, InputRange> ranges = inputRanges == null ? Map.of() : inputRanges;
        RandomGenerator random = seed == null ? new Well19937c() : new Well19937c(seed);

        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String node : targets) {
            if (!graph.containsNode(node)) {
                throw new InputGenerationException("Unknown node for input generation: " + node);
            }
            InputRange range = ranges.getOrDefault(node, InputRange.DEFAULT);
            double[] values = new double[numSamples];
            for (int i = 0; i < numSamples; i++) {
                values[i] = uniform(random, range);
            }
            columns.put(node, values);
        }
        return Trace.of(columns);
    }

    private static double uniform(RandomGenerator random, InputRange range) {
        return range.min() + random.nextDouble() * (range.max() - range.min());
    }
}
