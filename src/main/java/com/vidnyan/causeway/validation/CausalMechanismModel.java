package com.vidnyan.causeway.validation;

import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.trace.Trace;

import java.util.List;

/**
 * Predicts a node's values from its parents' values.
 */
public interface CausalMechanismModel {

    /**
     * @param data rows to predict for; must contain the parent columns
     * @return one prediction per row of {@code data}
     */
    double[] predict(String nodeId, List<String> parents, Trace data);

    /**
     * Fit to training rows. Models with fixed mechanisms return themselves.
     */
    default CausalMechanismModel fit(Trace train, CausalGraph graph) {
        return this;
    }
}
