package com.vidnyan.causeway.domain.validation;

/**
 * Bootstrap distribution summary of one node's R².
 */
public record BootstrapCI(
    String nodeId,
    double meanR2,
    double stdR2,
    double ciLower,
    double ciUpper,
    double confidenceLevel,
    int nBootstrap
) {}
