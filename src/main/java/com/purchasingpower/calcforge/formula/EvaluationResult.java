package com.purchasingpower.calcforge.formula;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of evaluating a formula: a value, or the reason no value could be produced.
 */
@Value
@Builder
public class EvaluationResult {

    boolean success;

    /**
     * Double, String or Boolean.
     */
    Object value;

    String error;

    public static EvaluationResult success(Object value) {
        return EvaluationResult.builder()
                .success(true)
                .value(value)
                .build();
    }

    public static EvaluationResult failure(String error) {
        return EvaluationResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
