package com.vidnyan.causeway.domain.intervention;

/**
 * {@code do(node = value)}: the node is held constant and its incoming edges are cut.
 */
public record HardIntervention(String node, double value) implements Intervention {

    @Override
    public String describe() {
        return node + " := " + format(value);
    }

    static String format(double value) {
        return value == Math.rint(value) && Math.abs(value) < 1e15
                ? Long.toString((long) value)
                : Double.toString(value);
    }
}
