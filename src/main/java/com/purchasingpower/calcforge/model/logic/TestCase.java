package com.purchasingpower.calcforge.model.logic;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Inputs and evaluator-computed expectations for one calculation.
 */
@Value
@Builder
public class TestCase {

    String name;

    String calculationId;

    @Builder.Default
    Map<String, Object> inputs = Map.of();

    /**
     * Value of every formula the calculation computes, keyed by address.
     */
    @Builder.Default
    Map<String, Object> expected = Map.of();
}
