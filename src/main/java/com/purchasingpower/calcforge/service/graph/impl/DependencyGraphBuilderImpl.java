package com.purchasingpower.calcforge.service.graph.impl;

import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.classification.CellRole;
import com.purchasingpower.calcforge.model.classification.ClassifiedCell;
import com.purchasingpower.calcforge.model.graph.CalculationCluster;
import com.purchasingpower.calcforge.model.graph.CircularRef;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.graph.Edge;
import com.purchasingpower.calcforge.model.graph.GraphNode;
import com.purchasingpower.calcforge.model.graph.SemanticPurpose;
import com.purchasingpower.calcforge.service.classification.LabelLocator;
import com.purchasingpower.calcforge.service.graph.DependencyGraphBuilder;
import com.purchasingpower.calcforge.util.CellAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Builds the dependency graph over address strings.
 *
 * <p>Nodes, edges and adjacency lists are all keyed by address, so a circular
 * reference is plain graph data. Iteration follows node insertion order, which makes
 * the execution order and cluster numbering deterministic for a given workbook.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DependencyGraphBuilderImpl implements DependencyGraphBuilder {

    private static final Pattern LABEL_NOISE = Pattern.compile("[^a-zA-Z0-9 _-]");

    private final RangeExpander rangeExpander;

    @Override
    public DependencyGraph build(CellClassificationResult classification) {
        // Step 1: one node per classified cell, then synthesized nodes for referenced blanks
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        for (ClassifiedCell cell : classification.allCells()) {
            nodes.put(cell.getAddress(), GraphNode.builder()
                    .address(cell.getAddress())
                    .sheet(cell.getSheet())
                    .role(cell.getRole())
                    .formula(cell.getFormula())
                    .build());
        }

        // Step 2: edges source -> target, deduplicated per pair
        Set<Edge> edgeSet = new LinkedHashSet<>();
        for (ClassifiedCell cell : classification.allCells()) {
            if (!cell.hasFormula()) {
                continue;
            }
            for (String reference : cell.getReferences()) {
                for (String source : rangeExpander.expand(reference)) {
                    nodes.computeIfAbsent(source, this::synthesize);
                    edgeSet.add(new Edge(source, cell.getAddress()));
                }
            }
        }
        List<Edge> edges = List.copyOf(edgeSet);

        Map<String, List<String>> upstream = new LinkedHashMap<>();
        Map<String, List<String>> downstream = new LinkedHashMap<>();
        for (String address : nodes.keySet()) {
            upstream.put(address, new ArrayList<>());
            downstream.put(address, new ArrayList<>());
        }
        for (Edge edge : edges) {
            downstream.get(edge.getSource()).add(edge.getTarget());
            upstream.get(edge.getTarget()).add(edge.getSource());
        }

        // Step 3: execution order and cycles
        List<String> executionOrder = topologicalOrder(nodes.keySet(), upstream, downstream);
        List<CircularRef> circularRefs = new ArrayList<>();
        if (executionOrder.size() < nodes.size()) {
            Set<String> ordered = new HashSet<>(executionOrder);
            List<String> remaining = nodes.keySet().stream().filter(address -> !ordered.contains(address)).toList();
            circularRefs.add(new CircularRef(remaining, "error"));
            log.warn("Circular reference among {} cells: {}", remaining.size(), remaining);
        }

        Map<String, Integer> depths = depths(executionOrder, upstream);

        // Step 4: clusters over the undirected view
        List<CalculationCluster> clusters = clusters(nodes, upstream, downstream, new LabelLocator(classification));
        Map<String, String> clusterOf = new HashMap<>();
        for (CalculationCluster cluster : clusters) {
            cluster.getNodes().forEach(address -> clusterOf.put(address, cluster.getId()));
        }

        Map<String, GraphNode> finished = new LinkedHashMap<>();
        nodes.forEach((address, node) -> finished.put(address, node.toBuilder()
                .inDegree(upstream.get(address).size())
                .outDegree(downstream.get(address).size())
                .depth(depths.getOrDefault(address, -1))
                .clusterId(clusterOf.get(address))
                .build()));

        DependencyGraph graph = DependencyGraph.builder()
                .nodes(Collections.unmodifiableMap(finished))
                .edges(edges)
                .upstream(freeze(upstream))
                .downstream(freeze(downstream))
                .executionOrder(List.copyOf(executionOrder))
                .clusters(List.copyOf(clusters))
                .circularRefs(List.copyOf(circularRefs))
                .namedRanges(classification.getNamedRanges())
                .build();

        log.info("Built dependency graph: {} nodes, {} edges, {} clusters, {} circular references",
                finished.size(), edges.size(), clusters.size(), circularRefs.size());
        return graph;
    }

    private GraphNode synthesize(String address) {
        boolean opaque = rangeExpander.isOpaque(address);
        if (opaque) {
            log.debug("Keeping {} as one opaque range node", address);
        }
        return GraphNode.builder()
                .address(address)
                .sheet(CellAddresses.sheetOf(address))
                .role(CellRole.INPUT)
                .synthesized(true)
                .opaqueRange(opaque)
                .build();
    }

    /**
     * Kahn's algorithm. Nodes caught in or behind a cycle never reach in-degree zero
     * and are left out.
     */
    private static List<String> topologicalOrder(Collection<String> addresses, Map<String, List<String>> upstream,
                                                 Map<String, List<String>> downstream) {
        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String address : addresses) {
            int degree = upstream.get(address).size();
            inDegree.put(address, degree);
            if (degree == 0) {
                queue.add(address);
            }
        }
        List<String> order = new ArrayList<>(addresses.size());
        while (!queue.isEmpty()) {
            String address = queue.poll();
            order.add(address);
            for (String child : downstream.get(address)) {
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(child);
                }
            }
        }
        return order;
    }

    private static Map<String, Integer> depths(List<String> executionOrder, Map<String, List<String>> upstream) {
        Map<String, Integer> depths = new HashMap<>();
        for (String address : executionOrder) {
            int depth = 0;
            for (String parent : upstream.get(address)) {
                depth = Math.max(depth, depths.get(parent) + 1);
            }
            depths.put(address, depth);
        }
        return depths;
    }

    private List<CalculationCluster> clusters(Map<String, GraphNode> nodes, Map<String, List<String>> upstream,
                                              Map<String, List<String>> downstream, LabelLocator labels) {
        List<CalculationCluster> clusters = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : nodes.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            Set<String> component = component(start, upstream, downstream);
            visited.addAll(component);
            boolean hasFormula = component.stream().anyMatch(address -> nodes.get(address).hasFormula());
            if (!hasFormula) {
                continue;
            }

            List<String> inputs = new ArrayList<>();
            List<String> outputs = new ArrayList<>();
            List<String> intermediates = new ArrayList<>();
            for (String address : component) {
                GraphNode node = nodes.get(address);
                if (node.getRole() == CellRole.FORMULA_OUTPUT) {
                    outputs.add(address);
                } else if (node.getRole() == CellRole.FORMULA_INTERMEDIATE) {
                    intermediates.add(address);
                } else if (!node.isOpaqueRange()) {
                    inputs.add(address);
                }
            }
            Collections.sort(inputs);
            Collections.sort(outputs);
            Collections.sort(intermediates);

            int index = clusters.size();
            Optional<String> label = clusterLabel(labels, outputs, inputs);
            clusters.add(CalculationCluster.builder()
                    .id(label.map(text -> "cluster_" + index + "_" + slug(text)).orElse("cluster_" + index))
                    .label(label.orElse(null))
                    .nodes(List.copyOf(new TreeSet<>(component)))
                    .inputs(List.copyOf(inputs))
                    .outputs(List.copyOf(outputs))
                    .intermediates(List.copyOf(intermediates))
                    .semanticPurpose(semanticPurpose(nodes, component))
                    .build());
        }
        return clusters;
    }

    private static Set<String> component(String start, Map<String, List<String>> upstream,
                                         Map<String, List<String>> downstream) {
        Set<String> component = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String address = stack.pop();
            if (!component.add(address)) {
                continue;
            }
            downstream.get(address).forEach(stack::push);
            upstream.get(address).forEach(stack::push);
        }
        return component;
    }

    /**
     * Label of the first labelled output, else input, that still has text once cleaned.
     */
    private static Optional<String> clusterLabel(LabelLocator labels, List<String> outputs, List<String> inputs) {
        for (String address : concat(outputs, inputs)) {
            Optional<String> label = labels.labelFor(address);
            if (label.isPresent() && !slug(label.get()).isEmpty()) {
                return label;
            }
        }
        return Optional.empty();
    }

    private static String slug(String label) {
        return LABEL_NOISE.matcher(label).replaceAll("").trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Highest-scoring keyword group over the upper-cased formulas, or null when nothing scored.
     */
    private static SemanticPurpose semanticPurpose(Map<String, GraphNode> nodes, Set<String> component) {
        StringBuilder joined = new StringBuilder();
        for (String address : component) {
            String formula = nodes.get(address).getFormula();
            if (formula != null) {
                joined.append(formula.toUpperCase(Locale.ROOT)).append(' ');
            }
        }
        String formulas = joined.toString();
        SemanticPurpose best = null;
        int bestScore = 0;
        for (SemanticPurpose purpose : SemanticPurpose.values()) {
            int score = 0;
            for (String keyword : purpose.getKeywords()) {
                score += occurrences(formulas, keyword);
            }
            if (score > bestScore) {
                best = purpose;
                bestScore = score;
            }
        }
        return best;
    }

    private static int occurrences(String text, String keyword) {
        int count = 0;
        int from = text.indexOf(keyword);
        while (from >= 0) {
            count++;
            from = text.indexOf(keyword, from + keyword.length());
        }
        return count;
    }

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> adjacency) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        adjacency.forEach((address, neighbours) -> frozen.put(address, List.copyOf(neighbours)));
        return Collections.unmodifiableMap(frozen);
    }
}
