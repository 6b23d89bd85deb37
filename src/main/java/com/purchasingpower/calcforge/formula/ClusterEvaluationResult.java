package com.purchasingpower.calcforge.formula;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of evaluating a sequence of formulas: every target's value, or the first failure.
 */
@Value
@Builder
public class ClusterEvaluationResult {

    boolean success;

    /**
     * Target address to computed value, in evaluation order. Empty on failure.
     */
    @Builder.Default
    Map<String, Object> values = Map.of();

    String error;

    public static ClusterEvaluationResult success(Map<String, Object> values) {
        return ClusterEvaluationResult.builder()
                .success(true)
                .values(values)
                .build();
    }

    public static ClusterEvaluationResult failure(String error) {
        return ClusterEvaluationResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
