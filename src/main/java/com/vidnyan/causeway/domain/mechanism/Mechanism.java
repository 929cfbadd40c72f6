package com.vidnyan.causeway.domain.mechanism;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification of how a node's value depends on its inputs.
 *
 * @param parameters kind-specific: {@code value} for constants; {@code coefficient},
 *                   {@code offset}, {@code variable} for single-variable linear;
 *                   {@code coefficients}, {@code offset} for multi-variable linear;
 *                   {@code function} for nonlinear
 * @param confidence in [0, 1]
 */
public record Mechanism(
    MechanismKind kind,
    Map<String, Object> parameters,
    double confidence,
    List<String> variables,
    String expression
) {

    public Mechanism {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        variables = List.copyOf(variables);
    }

    public static Mechanism constant(Object value, String expression) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("value", value);
        return new Mechanism(MechanismKind.CONSTANT, parameters, 1.0, List.of(), expression);
    }

    public static Mechanism unknown(double confidence, List<String> variables, String expression) {
        return new Mechanism(MechanismKind.UNKNOWN, Map.of(), confidence, variables, expression);
    }

    public Object value() {
        return parameters.get("value");
    }

    @JsonIgnore
    public boolean isMultiVariable() {
        return parameters.containsKey("coefficients");
    }

    public double coefficient() {
        return number("coefficient");
    }

    public double offset() {
        return number("offset");
    }

    public String variable() {
        Object variable = parameters.get("variable");
        return variable != null ? variable.toString() : null;
    }

    /**
     * Per-variable coefficients. Single-variable linear mechanisms report their one coefficient.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Double> coefficients() {
        Object coefficients = parameters.get("coefficients");
        if (coefficients instanceof Map<?, ?> map) {
            return (Map<String, Double>) map;
        }
        if (kind == MechanismKind.LINEAR && variable() != null) {
            return Map.of(variable(), coefficient());
        }
        return Map.of();
    }

    private double number(String key) {
        Object value = parameters.get(key);
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}
