package com.vidnyan.causeway.validation;

import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.trace.Trace;
import com.vidnyan.causeway.simulation.NodeFunction;

import java.util.List;
import java.util.Map;

/**
 * Predictions by re-running the node functions on observed parent values.
 * Rows where the function throws predict NaN.
 */
public final class FunctionModel implements CausalMechanismModel {

    private final Map<String, NodeFunction> functions;

    public FunctionModel(Map<String, NodeFunction> functions) {
        this.functions = Map.copyOf(functions);
    }

    @Override
    public double[] predict(String nodeId, List<String> parents, Trace data) {
        NodeFunction function = functions.get(nodeId);
        if (function == null) {
            throw new FittingException("No function for node " + nodeId);
        }
        List<String> parameters = function.parameters();
        for (String parameter : parameters) {
            if (!data.hasColumn(parameter)) {
                throw new FittingException("Parameter '" + parameter + "' of node " + nodeId + " is not observed");
            }
        }

        double[] predictions = new double[data.rowCount()];
        double[] arguments = new double[parameters.size()];
        for (int row = 0; row < predictions.length; row++) {
            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = data.value(parameters.get(i), row);
            }
            try {
                predictions[row] = function.invoke(arguments);
            } catch (Exception e) {
                predictions[row] = Double.NaN;
            }
        }
        return predictions;
    }
}
