package com.vidnyan.causeway.domain.intervention;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code do(node = f(node))}: the node keeps its parents and its value is transformed.
 *
 * @param param      shift amount or scale factor; unused for custom transforms
 * @param customExpr expression in terms of the node, for {@link SoftTransform#CUSTOM}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SoftIntervention(
    String node,
    SoftTransform transform,
    Double param,
    @JsonProperty("custom_expr") String customExpr
) implements Intervention {

    public static SoftIntervention shift(String node, double amount) {
        return new SoftIntervention(node, SoftTransform.SHIFT, amount, null);
    }

    public static SoftIntervention scale(String node, double factor) {
        return new SoftIntervention(node, SoftTransform.SCALE, factor, null);
    }

    public static SoftIntervention custom(String node, String expression) {
        return new SoftIntervention(node, SoftTransform.CUSTOM, null, expression);
    }

    /**
     * @throws IllegalStateException if the transform lacks what it needs
     */
    @Override
    public String describe() {
        switch (transform) {
            case SHIFT:
                requireParam();
                return node + " := " + node + " + " + HardIntervention.format(param);
            case SCALE:
                requireParam();
                return node + " := " + node + " * " + HardIntervention.format(param);
            default:
                if (customExpr == null || customExpr.isBlank()) {
                    throw new IllegalStateException("Custom intervention on " + node + " has no expression");
                }
                return node + " := " + customExpr;
        }
    }

    private void requireParam() {
        if (param == null) {
            throw new IllegalStateException(transform.label() + " intervention on " + node + " has no param");
        }
    }
}
