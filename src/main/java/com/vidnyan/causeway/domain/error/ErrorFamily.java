package com.vidnyan.causeway.domain.error;

/**
 * Error families raised by the causal pipeline.
 * The orchestrator degrades over these instead of catching arbitrary exceptions.
 */
public enum ErrorFamily {
    GRAPH_CONSTRUCTION,
    FITTING,
    TRACE_COLLECTION,
    INTERVENTION,
    EXTERNAL_SERVICE
}
