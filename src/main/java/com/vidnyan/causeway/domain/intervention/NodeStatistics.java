package com.vidnyan.causeway.domain.intervention;

/**
 * Summary of one node's interventional samples.
 */
public record NodeStatistics(
    double mean,
    double std,
    double q05,
    double q50,
    double q95,
    double min,
    double max
) {}
