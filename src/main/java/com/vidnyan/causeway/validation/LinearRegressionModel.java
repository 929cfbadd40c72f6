package com.vidnyan.causeway.validation;

import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.trace.Trace;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordinary least squares of each non-root node on its parents, fitted on training rows.
 */
@Slf4j
public final class LinearRegressionModel implements CausalMechanismModel {

    private final Map<String, double[]> coefficients;

    public LinearRegressionModel() {
        this(Map.of());
    }

    private LinearRegressionModel(Map<String, double[]> coefficients) {
        this.coefficients = coefficients;
    }

    @Override
    public CausalMechanismModel fit(Trace train, CausalGraph graph) {
        Map<String, double[]> fitted = new HashMap<>();
        for (String nodeId : graph.nodeIds()) {
            List<String> parents = List.copyOf(graph.predecessors(nodeId));
            if (parents.isEmpty() || !train.hasColumn(nodeId)) {
                continue;
            }
            try {
                fitted.put(nodeId, regress(train, nodeId, parents));
            } catch (IllegalArgumentException e) {
                // singular design or fewer rows than coefficients
                log.warn("Failed to fit {} on {}: {}", nodeId, parents, e.getMessage());
            }
        }
        return new LinearRegressionModel(Map.copyOf(fitted));
    }

    @Override
    public double[] predict(String nodeId, List<String> parents, Trace data) {
        double[] beta = coefficients.get(nodeId);
        if (beta == null) {
            throw new FittingException("No fitted regression for node " + nodeId);
        }
        double[] predictions = new double[data.rowCount()];
        for (int row = 0; row < predictions.length; row++) {
            double value = beta[0];
            for (int j = 0; j < parents.size(); j++) {
                value += beta[j + 1] * data.value(parents.get(j), row);
            }
            predictions[row] = value;
        }
        return predictions;
    }

    private static double[] regress(Trace train, String nodeId, List<String> parents) {
        int rows = train.rowCount();
        double[][] x = new double[rows][parents.size()];
        for (int j = 0; j < parents.size(); j++) {
            double[] column = train.column(parents.get(j));
            for (int i = 0; i < rows; i++) {
                x[i][j] = column[i];
            }
        }
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.newSampleData(train.column(nodeId), x);
        return regression.estimateRegressionParameters();
    }
}
