package com.vidnyan.causeway.application.port.in;

import com.vidnyan.causeway.domain.intervention.InterventionResult;
import com.vidnyan.causeway.domain.model.CausalBundle;

/**
 * Run a do-query against the model in an enhancement result.
 */
public interface QueryInterventionUseCase {

    /**
     * @param request DSL text, a JSON-like map, an intervention or a spec
     * @throws com.vidnyan.causeway.domain.error.InterventionException if the bundle has no model,
     *         the request is invalid, or the query fails
     */
    InterventionResult query(CausalBundle bundle, Object request);
}
