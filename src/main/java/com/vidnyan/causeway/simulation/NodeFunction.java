package com.vidnyan.causeway.simulation;

import java.util.List;

/**
 * Code attached to a graph node: declared parameter names and an invocation.
 * Parameters are resolved by name against values already computed in a trial.
 */
public interface NodeFunction {

    List<String> parameters();

    /**
     * @param arguments values in {@link #parameters()} order
     * @throws Exception any failure marks the trial as failed
     */
    double invoke(double[] arguments) throws Exception;

    /**
     * Whether the function would only produce a value asynchronously.
     */
    default boolean isAsync() {
        return false;
    }

    @FunctionalInterface
    interface Body {
        double apply(double[] arguments) throws Exception;
    }

    static NodeFunction of(List<String> parameters, Body body) {
        List<String> names = List.copyOf(parameters);
        return new NodeFunction() {
            @Override
            public List<String> parameters() {
                return names;
            }

            @Override
            public double invoke(double[] arguments) throws Exception {
                return body.apply(arguments);
            }

            @Override
            public String toString() {
                return "NodeFunction" + names;
            }
        };
    }
}
