package com.vidnyan.causeway.validation;

import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.trace.Trace;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Predictions from statically inferred mechanisms.
 * <p>
 * Constant and linear mechanisms predict; other kinds have no closed form and fail.
 * A mechanism variable is matched to a parent column by id, then by node name.
 */
public final class MechanismModel implements CausalMechanismModel {

    private final Map<String, Mechanism> mechanisms;
    private final CausalGraph graph;

    public MechanismModel(Map<String, Mechanism> mechanisms) {
        this(mechanisms, null);
    }

    private MechanismModel(Map<String, Mechanism> mechanisms, CausalGraph graph) {
        this.mechanisms = Map.copyOf(mechanisms);
        this.graph = graph;
    }

    @Override
    public CausalMechanismModel fit(Trace train, CausalGraph graph) {
        return new MechanismModel(mechanisms, graph);
    }

    @Override
    public double[] predict(String nodeId, List<String> parents, Trace data) {
        Mechanism mechanism = mechanisms.get(nodeId);
        if (mechanism == null) {
            throw new FittingException("No mechanism for node " + nodeId);
        }

        double[] predictions = new double[data.rowCount()];
        switch (mechanism.kind()) {
            case CONSTANT -> {
                if (!(mechanism.value() instanceof Number number)) {
                    throw new FittingException("Non-numeric constant for node " + nodeId);
                }
                Arrays.fill(predictions, number.doubleValue());
            }
            case LINEAR -> {
                Arrays.fill(predictions, mechanism.offset());
                for (Map.Entry<String, Double> term : mechanism.coefficients().entrySet()) {
                    double[] column = data.column(resolveColumn(nodeId, term.getKey(), parents, data));
                    for (int i = 0; i < predictions.length; i++) {
                        predictions[i] += term.getValue() * column[i];
                    }
                }
            }
            default -> throw new FittingException("Mechanism " + mechanism.kind()
                    + " for node " + nodeId + " has no closed form: " + mechanism.expression());
        }
        return predictions;
    }

    private String resolveColumn(String nodeId, String variable, List<String> parents, Trace data) {
        if (parents.contains(variable)) {
            return variable;
        }
        if (graph != null) {
            for (String parent : parents) {
                String name = graph.node(parent).map(GraphNode::name).orElse(null);
                if (Objects.equals(name, variable)) {
                    return parent;
                }
            }
        }
        if (data.hasColumn(variable)) {
            return variable;
        }
        throw new FittingException("Cannot resolve variable '" + variable + "' of node " + nodeId
                + " among parents " + parents);
    }
}
