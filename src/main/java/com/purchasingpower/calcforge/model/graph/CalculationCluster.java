package com.purchasingpower.calcforge.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Weakly-connected component of the dependency graph that contains at least one formula.
 */
@Value
@Builder
public class CalculationCluster {

    String id;

    /**
     * Label of the cell the id was named after, if any.
     */
    String label;

    @Builder.Default
    List<String> nodes = List.of();

    @Builder.Default
    List<String> inputs = List.of();

    @Builder.Default
    List<String> outputs = List.of();

    @Builder.Default
    List<String> intermediates = List.of();

    /**
     * Null when no keyword group scored.
     */
    SemanticPurpose semanticPurpose;

    public boolean contains(String address) {
        return nodes.contains(address);
    }
}
