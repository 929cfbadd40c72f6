package com.vidnyan.causeway.domain.validation;

import java.util.List;
import java.util.Map;

/**
 * Cross-validation outcome over every non-root node.
 *
 * @param aggregateR2 mean of the node scores weighted by their sample counts
 * @param failedNodes nodes below the threshold or that could not be scored
 */
public record ValidationResult(
    Map<String, R2Score> scores,
    double aggregateR2,
    boolean passesThreshold,
    double threshold,
    int trainSize,
    int testSize,
    List<String> failedNodes
) {

    public ValidationResult {
        scores = Map.copyOf(scores);
        failedNodes = List.copyOf(failedNodes);
    }

    public String summary() {
        String status = passesThreshold ? "PASS" : "FAIL";
        StringBuilder out = new StringBuilder()
                .append("ValidationResult(").append(status).append(")\n")
                .append(String.format("  Aggregate R²: %.4f (threshold: %.2f)%n", aggregateR2, threshold))
                .append(String.format("  Train/Test: %d/%d samples%n", trainSize, testSize))
                .append(String.format("  Nodes validated: %d%n", scores.size()));
        if (!failedNodes.isEmpty()) {
            out.append("  Failed nodes: ").append(failedNodes).append('\n');
        }
        return out.toString();
    }
}
