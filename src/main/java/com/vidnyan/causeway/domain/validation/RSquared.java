package com.vidnyan.causeway.domain.validation;

/**
 * Coefficient of determination with its sums of squares.
 */
public record RSquared(double r2, double ssRes, double ssTot) {}
