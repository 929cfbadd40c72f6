package com.vidnyan.causeway.validation;

import com.vidnyan.causeway.domain.error.InsufficientDataException;
import com.vidnyan.causeway.domain.error.StatisticalValidationException;
import com.vidnyan.causeway.domain.error.ThresholdException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.trace.Trace;
import com.vidnyan.causeway.domain.validation.BootstrapCI;
import com.vidnyan.causeway.domain.validation.RSquared;
import com.vidnyan.causeway.domain.validation.TrainTestSplit;
import com.vidnyan.causeway.domain.validation.ValidationResult;
import com.vidnyan.causeway.simulation.NodeFunction;
import com.vidnyan.causeway.simulation.TraceCollector;
import com.vidnyan.causeway.mechanism.StaticMechanismInferrer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationEngineTest {

    private final ValidationEngine engine = new ValidationEngine();

    private static CausalGraph chain() {
        return CausalGraph.ofEdges(new String[] {"x", "y"}, new String[] {"y", "z"});
    }

    private static Map<String, NodeFunction> chainFunctions() {
        return Map.of(
                "y", NodeFunction.of(List.of("x"), args -> 2 * args[0]),
                "z", NodeFunction.of(List.of("y"), args -> args[0] + 1));
    }

    private static Trace chainTrace(int samples) {
        return TraceCollector.withDefaults().collect(chain(), chainFunctions(), samples, null, 42L);
    }

    private static Trace sequence(int rows) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        double[] values = new double[rows];
        for (int i = 0; i < rows; i++) {
            values[i] = i;
        }
        columns.put("x", values);
        return Trace.of(columns);
    }

    @Test
    void rSquared_PerfectPrediction() {
        double[] y = {1, 2, 3, 4};

        RSquared r2 = engine.rSquared(y, y.clone());

        assertEquals(1.0, r2.r2(), 1e-12);
        assertEquals(0.0, r2.ssRes(), 1e-12);
    }

    @Test
    void rSquared_MeanPredictionScoresZero() {
        double[] y = {1, 2, 3, 4};
        double[] mean = {2.5, 2.5, 2.5, 2.5};

        assertEquals(0.0, engine.rSquared(y, mean).r2(), 1e-12);
    }

    @Test
    void rSquared_WorseThanMeanIsNegative() {
        double[] y = {1, 2, 3, 4};
        double[] reversed = {4, 3, 2, 1};

        assertTrue(engine.rSquared(y, reversed).r2() < 0);
    }

    @Test
    void rSquared_IgnoresNonFinitePairs() {
        double[] y = {1, 2, Double.NaN, 4};
        double[] p = {1, 2, 3, Double.POSITIVE_INFINITY};

        RSquared r2 = engine.rSquared(y, p);

        assertEquals(1.0, r2.r2(), 1e-12);
    }

    @Test
    void rSquared_ConstantTarget() {
        double[] constant = {3, 3, 3};

        assertEquals(1.0, engine.rSquared(constant, constant.clone()).r2());
        assertThrows(StatisticalValidationException.class,
                () -> engine.rSquared(constant, new double[] {3, 3, 4}));
    }

    @Test
    void rSquared_RejectsBadInput() {
        assertThrows(StatisticalValidationException.class,
                () -> engine.rSquared(new double[] {1, 2}, new double[] {1}));
        assertThrows(StatisticalValidationException.class,
                () -> engine.rSquared(new double[] {1}, new double[] {1}));
        assertThrows(StatisticalValidationException.class,
                () -> engine.rSquared(new double[] {Double.NaN, Double.NaN}, new double[] {1, 2}));
    }

    @Test
    void trainTestSplit_EightyTwenty() {
        // Act
        TrainTestSplit split = engine.trainTestSplit(sequence(100), 0.2, 42L);

        // Assert
        assertEquals(80, split.train().rowCount());
        assertEquals(20, split.test().rowCount());
        double[] all = new double[100];
        System.arraycopy(split.train().column("x"), 0, all, 0, 80);
        System.arraycopy(split.test().column("x"), 0, all, 80, 20);
        Arrays.sort(all);
        assertArrayEquals(sequence(100).column("x"), all, "every row lands on exactly one side");
    }

    @Test
    void trainTestSplit_SameSeedIsReproducible() {
        TrainTestSplit first = engine.trainTestSplit(sequence(50), 0.3, 5L);
        TrainTestSplit second = engine.trainTestSplit(sequence(50), 0.3, 5L);

        assertArrayEquals(first.test().column("x"), second.test().column("x"));
    }

    @Test
    void trainTestSplit_TooFewRows() {
        assertThrows(InsufficientDataException.class, () -> engine.trainTestSplit(sequence(3), 0.2, 1L));
    }

    @Test
    void trainTestSplit_RejectsTestSizeOutsideUnitInterval() {
        assertThrows(StatisticalValidationException.class, () -> engine.trainTestSplit(sequence(10), 0.0, 1L));
        assertThrows(StatisticalValidationException.class, () -> engine.trainTestSplit(sequence(10), 1.0, 1L));
    }

    @Test
    void crossValidate_TrueFunctionsPass() {
        ValidationResult result = engine.crossValidate(new FunctionModel(chainFunctions()), chainTrace(100),
                chain(), 0.2, 0.9, 1L);

        assertTrue(result.passesThreshold());
        assertEquals(2, result.scores().size(), "the root is not scored");
        assertEquals(1.0, result.aggregateR2(), 1e-9);
        assertEquals(80, result.trainSize());
        assertEquals(20, result.testSize());
        assertTrue(result.summary().contains("PASS"));
    }

    @Test
    void crossValidate_LinearRegressionRecoversChain() {
        ValidationResult result = engine.crossValidate(new LinearRegressionModel(), chainTrace(100),
                chain(), 0.2, 0.9, 1L);

        assertEquals(1.0, result.aggregateR2(), 1e-6);
        assertTrue(result.failedNodes().isEmpty());
    }

    @Test
    void crossValidate_StaticMechanismsResolveByName() {
        StaticMechanismInferrer inferrer = new StaticMechanismInferrer();
        Map<String, Mechanism> mechanisms = Map.of(
                "y", inferrer.infer("double f(double x) { return x * 2; }"),
                "z", inferrer.infer("double g(double y) { return y + 1; }"));

        ValidationResult result = engine.crossValidate(new MechanismModel(mechanisms), chainTrace(100),
                chain(), 0.2, 0.9, 1L);

        assertEquals(1.0, result.aggregateR2(), 1e-9);
    }

    @Test
    void crossValidate_WrongMechanismFailsWithResult() {
        Map<String, NodeFunction> wrong = Map.of(
                "y", NodeFunction.of(List.of("x"), args -> -2 * args[0]),
                "z", NodeFunction.of(List.of("y"), args -> args[0] + 1));

        ThresholdException error = assertThrows(ThresholdException.class,
                () -> engine.crossValidate(new FunctionModel(wrong), chainTrace(100), chain(), 0.2, 0.7, 1L));

        assertFalse(error.result().passesThreshold());
        assertTrue(error.result().failedNodes().contains("y"));
    }

    @Test
    void crossValidate_MissingMechanismMarksNodeFailed() {
        Map<String, NodeFunction> partial = Map.of("y", NodeFunction.of(List.of("x"), args -> 2 * args[0]));

        ThresholdException error = assertThrows(ThresholdException.class,
                () -> engine.crossValidate(new FunctionModel(partial), chainTrace(100), chain(), 0.2, 0.7, 1L));

        assertEquals(List.of("z"), error.result().failedNodes());
        assertTrue(error.result().scores().containsKey("y"));
    }

    @Test
    void bootstrap_PerfectModelHasTightInterval() {
        Map<String, BootstrapCI> intervals = engine.bootstrapConfidenceIntervals(
                new LinearRegressionModel(), chainTrace(60), chain(), 100, 0.95, 3L);

        assertEquals(2, intervals.size());
        BootstrapCI y = intervals.get("y");
        assertEquals(1.0, y.meanR2(), 1e-6);
        assertTrue(y.ciLower() <= y.ciUpper());
        assertEquals(0.95, y.confidenceLevel());
        assertTrue(y.nBootstrap() >= 10);
    }

    @Test
    void bootstrap_RejectsTooFewIterations() {
        assertThrows(StatisticalValidationException.class, () -> engine.bootstrapConfidenceIntervals(
                new LinearRegressionModel(), chainTrace(60), chain(), 50, 0.95, 3L));
        assertThrows(StatisticalValidationException.class, () -> engine.bootstrapConfidenceIntervals(
                new LinearRegressionModel(), chainTrace(60), chain(), 100, 1.0, 3L));
    }
}
