package com.purchasingpower.calcforge.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed graph of cell dependencies keyed by address.
 *
 * <p>{@code upstream} and {@code downstream} are adjacency lists over the same edges:
 * {@code upstream.get(t)} holds every source read by the formula at {@code t}.
 */
@Value
@Builder
public class DependencyGraph {

    /**
     * Nodes in insertion order: classified cells sheet by sheet, then synthesized ones.
     */
    @Builder.Default
    Map<String, GraphNode> nodes = Map.of();

    @Builder.Default
    List<Edge> edges = List.of();

    @Builder.Default
    Map<String, List<String>> upstream = Map.of();

    @Builder.Default
    Map<String, List<String>> downstream = Map.of();

    @Builder.Default
    List<String> executionOrder = List.of();

    @Builder.Default
    List<CalculationCluster> clusters = List.of();

    @Builder.Default
    List<CircularRef> circularRefs = List.of();

    /**
     * Named ranges carried forward from classification for formula parsing.
     */
    @Builder.Default
    Map<String, String> namedRanges = Map.of();

    public Optional<GraphNode> node(String address) {
        return Optional.ofNullable(nodes.get(address));
    }

    public List<String> parentsOf(String address) {
        return upstream.getOrDefault(address, List.of());
    }

    public List<String> childrenOf(String address) {
        return downstream.getOrDefault(address, List.of());
    }

    public boolean isCircular(String address) {
        return circularRefs.stream().anyMatch(ref -> ref.involves(address));
    }
}
