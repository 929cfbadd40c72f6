package com.vidnyan.causeway.validation;

import com.vidnyan.causeway.domain.error.CausalException;
import com.vidnyan.causeway.domain.error.InsufficientDataException;
import com.vidnyan.causeway.domain.error.StatisticalValidationException;
import com.vidnyan.causeway.domain.error.ThresholdException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.trace.Trace;
import com.vidnyan.causeway.domain.validation.*;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Held-out R² scoring of a fitted causal model.
 */
@Slf4j
@Component
public class ValidationEngine {

    private static final int MIN_BOOTSTRAP = 100;
    private static final int MIN_BOOTSTRAP_SAMPLES_PER_NODE = 10;
    private static final double BOOTSTRAP_TEST_SIZE = 0.2;

    /**
     * R² = 1 - SS_res / SS_tot over the pairs where both values are finite.
     *
     * @throws StatisticalValidationException for mismatched lengths, fewer than two finite
     *                                        pairs, or a constant target the predictions miss
     */
    public RSquared rSquared(double[] yTrue, double[] yPred) {
        if (yTrue.length != yPred.length) {
            throw new StatisticalValidationException("yTrue and yPred must have same length: "
                    + yTrue.length + " != " + yPred.length);
        }
        if (yTrue.length < 2) {
            throw new StatisticalValidationException("Need at least 2 samples for R², got " + yTrue.length);
        }

        int finite = 0;
        double[] t = new double[yTrue.length];
        double[] p = new double[yPred.length];
        for (int i = 0; i < yTrue.length; i++) {
            if (Double.isFinite(yTrue[i]) && Double.isFinite(yPred[i])) {
                t[finite] = yTrue[i];
                p[finite] = yPred[i];
                finite++;
            }
        }
        if (finite == 0) {
            throw new StatisticalValidationException("All values are NaN or infinite");
        }
        if (finite < 2) {
            throw new StatisticalValidationException("Need at least 2 finite samples, got " + finite);
        }

        double mean = new Mean().evaluate(t, 0, finite);
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < finite; i++) {
            double residual = t[i] - p[i];
            ssRes += residual * residual;
            double deviation = t[i] - mean;
            ssTot += deviation * deviation;
        }

        if (ssTot == 0.0) {
            if (ssRes == 0.0) {
                return new RSquared(1.0, 0.0, 0.0);
            }
            throw new StatisticalValidationException(
                    "yTrue has zero variance but predictions don't match (constant target)");
        }
        return new RSquared(1.0 - ssRes / ssTot, ssRes, ssTot);
    }

    /**
     * Shuffle rows, then reserve {@code ceil(n * testSize)} of them for test.
     *
     * @param seed fixes the shuffle; {@code null} for an unseeded one
     * @throws InsufficientDataException if either side would hold fewer than two rows
     */
    public TrainTestSplit trainTestSplit(Trace traces, double testSize, Long seed) {
        if (testSize <= 0 || testSize >= 1) {
            throw new StatisticalValidationException("testSize must be in (0, 1), got " + testSize);
        }
        int n = traces.rowCount();
        // absorbs float error in n * testSize
        int nTest = (int) Math.ceil(n * testSize - 1e-9);
        int nTrain = n - nTest;
        if (nTrain < 2) {
            throw new InsufficientDataException("Insufficient data for train split: need >= 2, got "
                    + nTrain + " (total samples: " + n + ")");
        }
        if (nTest < 2) {
            throw new InsufficientDataException("Insufficient data for test split: need >= 2, got "
                    + nTest + " (total samples: " + n + ")");
        }

        int[] rows = new int[n];
        for (int i = 0; i < n; i++) {
            rows[i] = i;
        }
        MathArrays.shuffle(rows, random(seed));

        log.debug("Split {} samples into {} train, {} test", n, nTrain, nTest);
        return new TrainTestSplit(
                traces.select(Arrays.copyOfRange(rows, 0, nTrain)),
                traces.select(Arrays.copyOfRange(rows, nTrain, n)));
    }

    /**
     * Fit on a training split, then score every non-root node on the test split.
     *
     * @throws ThresholdException if the weighted aggregate or any single node is below
     *                            {@code threshold}; the full result is attached
     */
    public ValidationResult crossValidate(CausalMechanismModel model, Trace traces, CausalGraph graph,
                                          double testSize, double threshold, Long seed) {
        TrainTestSplit split = trainTestSplit(traces, testSize, seed);
        CausalMechanismModel fitted = model.fit(split.train(), graph);

        Map<String, R2Score> scores = new LinkedHashMap<>();
        List<String> failedNodes = new ArrayList<>();

        for (String nodeId : graph.nodeIds()) {
            List<String> parents = List.copyOf(graph.predecessors(nodeId));
            if (parents.isEmpty()) {
                log.debug("Skipping root node: {}", nodeId);
                continue;
            }
            if (!split.test().hasColumn(nodeId)) {
                log.warn("Node {} not in traces, skipping", nodeId);
                continue;
            }

            double[] yTrue = split.test().column(nodeId);
            try {
                RSquared r2 = rSquared(yTrue, fitted.predict(nodeId, parents, split.test()));
                scores.put(nodeId, new R2Score(nodeId, r2.r2(), r2.ssRes(), r2.ssTot(), yTrue.length, parents));
                if (r2.r2() < threshold) {
                    failedNodes.add(nodeId);
                    log.warn("Node {} failed threshold: R²={} < {}", nodeId, r2.r2(), threshold);
                }
            } catch (CausalException | IllegalArgumentException e) {
                log.warn("Failed to validate node {}: {}", nodeId, e.getMessage());
                failedNodes.add(nodeId);
            }
        }

        if (scores.isEmpty()) {
            throw new StatisticalValidationException("No nodes to validate (all root nodes or missing data)");
        }

        int totalSamples = scores.values().stream().mapToInt(R2Score::nSamples).sum();
        double aggregate = scores.values().stream()
                .mapToDouble(s -> s.rSquared() * s.nSamples() / totalSamples)
                .sum();
        boolean passes = aggregate >= threshold && failedNodes.isEmpty();

        ValidationResult result = new ValidationResult(scores, aggregate, passes, threshold,
                split.train().rowCount(), split.test().rowCount(), failedNodes);
        log.info(result.summary());

        if (!passes) {
            throw new ThresholdException(String.format("Validation failed: aggregate R²=%.4f < %s, %d nodes failed",
                    aggregate, threshold, failedNodes.size()), result);
        }
        return result;
    }

    /**
     * Percentile intervals of each non-root node's R² over bootstrap resamples.
     * Nodes with fewer than ten successful resamples are left out.
     */
    public Map<String, BootstrapCI> bootstrapConfidenceIntervals(CausalMechanismModel model, Trace traces,
                                                                 CausalGraph graph, int nBootstrap,
                                                                 double confidenceLevel, Long seed) {
        if (nBootstrap < MIN_BOOTSTRAP) {
            throw new StatisticalValidationException(
                    "nBootstrap should be >= " + MIN_BOOTSTRAP + " for reliable CIs, got " + nBootstrap);
        }
        if (confidenceLevel <= 0 || confidenceLevel >= 1) {
            throw new StatisticalValidationException("confidenceLevel must be in (0, 1), got " + confidenceLevel);
        }

        Map<String, List<Double>> samples = new LinkedHashMap<>();
        for (String nodeId : graph.nodeIds()) {
            if (!graph.predecessors(nodeId).isEmpty()) {
                samples.put(nodeId, new ArrayList<>());
            }
        }

        RandomGenerator random = random(seed);
        int n = traces.rowCount();
        log.info("Running {} bootstrap iterations...", nBootstrap);

        for (int iteration = 0; iteration < nBootstrap; iteration++) {
            int[] rows = new int[n];
            for (int i = 0; i < n; i++) {
                rows[i] = random.nextInt(n);
            }
            TrainTestSplit split;
            try {
                split = trainTestSplit(traces.select(rows), BOOTSTRAP_TEST_SIZE, (long) random.nextInt(1_000_000));
            } catch (InsufficientDataException e) {
                log.warn("Bootstrap iteration {}: insufficient data, skipping", iteration);
                continue;
            }
            CausalMechanismModel fitted = model.fit(split.train(), graph);

            for (Map.Entry<String, List<Double>> entry : samples.entrySet()) {
                String nodeId = entry.getKey();
                if (!split.test().hasColumn(nodeId)) {
                    continue;
                }
                try {
                    double[] predicted = fitted.predict(nodeId, List.copyOf(graph.predecessors(nodeId)), split.test());
                    entry.getValue().add(rSquared(split.test().column(nodeId), predicted).r2());
                } catch (CausalException | IllegalArgumentException e) {
                    log.debug("Bootstrap iteration {} skipped {}: {}", iteration, nodeId, e.getMessage());
                }
            }
        }

        double alpha = 1 - confidenceLevel;
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        Map<String, BootstrapCI> intervals = new LinkedHashMap<>();

        samples.forEach((nodeId, values) -> {
            if (values.size() < MIN_BOOTSTRAP_SAMPLES_PER_NODE) {
                log.warn("Node {}: too few bootstrap samples ({})", nodeId, values.size());
                return;
            }
            double[] r2 = values.stream().mapToDouble(Double::doubleValue).toArray();
            BootstrapCI ci = new BootstrapCI(
                    nodeId,
                    new Mean().evaluate(r2),
                    new StandardDeviation().evaluate(r2),
                    percentile.evaluate(r2, alpha / 2 * 100),
                    percentile.evaluate(r2, (1 - alpha / 2) * 100),
                    confidenceLevel,
                    r2.length);
            log.debug("{}: R²={} ± {}, CI=[{}, {}]", nodeId, ci.meanR2(), ci.stdR2(), ci.ciLower(), ci.ciUpper());
            intervals.put(nodeId, ci);
        });
        return intervals;
    }

    private static RandomGenerator random(Long seed) {
        return seed == null ? new Well19937c() : new Well19937c(seed);
    }
}
