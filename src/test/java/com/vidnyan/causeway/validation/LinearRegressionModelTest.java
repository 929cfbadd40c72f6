package com.vidnyan.causeway.validation;

import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.trace.Trace;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LinearRegressionModelTest {

    private static final CausalGraph COLLIDER = CausalGraph.ofEdges(
            new String[] {"a", "c"}, new String[] {"b", "c"});

    private static Trace trace(double[] a, double[] b, double[] c) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("a", a);
        columns.put("b", b);
        columns.put("c", c);
        return Trace.of(columns);
    }

    @Test
    void fit_RecoversLinearCoefficients() {
        // Arrange
        Trace train = trace(
                new double[] {1, 2, 3, 4, 5, 6},
                new double[] {2, 1, 4, 3, 6, 5},
                new double[] {6, 5, 12, 11, 18, 17});

        // Act
        CausalMechanismModel model = new LinearRegressionModel().fit(train, COLLIDER);
        double[] predicted = model.predict("c", List.of("a", "b"), train);

        // Assert
        assertArrayEquals(train.column("c"), predicted, 1e-9);
    }

    @Test
    void fit_SkipsNodeWithTooFewRows() {
        // Arrange
        Trace train = trace(new double[] {1, 2}, new double[] {3, 4}, new double[] {5, 6});

        // Act
        CausalMechanismModel model = new LinearRegressionModel().fit(train, COLLIDER);

        // Assert
        assertThrows(FittingException.class, () -> model.predict("c", List.of("a", "b"), train));
    }
}
