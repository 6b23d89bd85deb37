package com.purchasingpower.calcforge.model.logic;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The formulas of one cluster in execution order.
 */
@Value
@Builder
public class CalculationUnit {

    /**
     * Cluster id, or the formula's address when the graph had no clusters.
     */
    String id;

    @Builder.Default
    List<ParsedFormula> formulas = List.of();

    /**
     * Addresses read by the unit but not computed by it. Sorted.
     */
    @Builder.Default
    List<String> inputs = List.of();

    @Builder.Default
    List<String> outputs = List.of();

    /**
     * {@code address = formula} lines in execution order.
     */
    @Builder.Default
    List<String> pseudocode = List.of();
}
