package com.purchasingpower.calcforge.service.graph.impl;

import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.graph.CalculationCluster;
import com.purchasingpower.calcforge.model.graph.CircularRef;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.graph.Edge;
import com.purchasingpower.calcforge.model.graph.GraphNode;
import com.purchasingpower.calcforge.model.graph.SemanticPurpose;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import com.purchasingpower.calcforge.service.classification.impl.CellClassifierImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.calcforge.WorkbookFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dependency Graph Builder Tests")
class DependencyGraphBuilderImplTest {

    private CellClassifierImpl classifier;
    private DependencyGraphBuilderImpl builder;

    @BeforeEach
    void setUp() {
        RangeExpander expander = rangeExpander();
        classifier = classifier(expander);
        builder = graphBuilder(expander);
    }

    private DependencyGraph build(WorkbookStructure workbook) {
        CellClassificationResult classification = classifier.classify(workbook);
        return builder.build(classification);
    }

    @Test
    @DisplayName("Should compute depths from the longest path to a root")
    void testBuild_ShouldComputeDepths() {
        DependencyGraph graph = build(loanCalculator());

        assertEquals(0, graph.node("Loan!B2").orElseThrow().getDepth());
        assertEquals(1, graph.node("Loan!B5").orElseThrow().getDepth());
        assertEquals(2, graph.node("Loan!B6").orElseThrow().getDepth());
        assertEquals(3, graph.node("Loan!B5").orElseThrow().getInDegree());
        assertEquals(2, graph.node("Loan!B2").orElseThrow().getOutDegree());
    }

    @Test
    @DisplayName("Should order every edge source before its target")
    void testBuild_ShouldProduceTopologicalOrder() {
        DependencyGraph graph = build(loanCalculator());

        List<String> order = graph.getExecutionOrder();
        assertEquals(graph.getNodes().size(), order.size());
        for (Edge edge : graph.getEdges()) {
            assertTrue(order.indexOf(edge.getSource()) < order.indexOf(edge.getTarget()),
                    () -> edge.getSource() + " should run before " + edge.getTarget());
        }
        assertTrue(graph.getEdges().contains(new Edge("Loan!B5", "Loan!B6")));
        assertEquals(List.of("Loan!B2", "Loan!B5"), graph.parentsOf("Loan!B6"));
    }

    @Test
    @DisplayName("Should name a cluster after its output label")
    void testBuild_ShouldLabelClusters() {
        DependencyGraph graph = build(loanCalculator());

        assertEquals(1, graph.getClusters().size());
        CalculationCluster cluster = graph.getClusters().get(0);
        assertEquals("cluster_0_amount_due", cluster.getId());
        assertEquals("Amount Due", cluster.getLabel());
        assertEquals(List.of("Loan!B2", "Loan!B3", "Loan!B4"), cluster.getInputs());
        assertEquals(List.of("Loan!B6"), cluster.getOutputs());
        assertEquals(List.of("Loan!B5"), cluster.getIntermediates());
        assertNull(cluster.getSemanticPurpose());
        assertEquals("cluster_0_amount_due", graph.node("Loan!B5").orElseThrow().getClusterId());
    }

    @Test
    @DisplayName("Should report a cycle once and leave its cells out of the order")
    void testBuild_ShouldIsolateCircularReferences() {
        DependencyGraph graph = build(workbook("cycle.xlsx", sheet("S",
                formula("A1", "=B1+1", 0), formula("B1", "=A1+1", 0),
                value("D1", 5), formula("E1", "=D1*2", 10))));

        assertEquals(List.of(new CircularRef(List.of("S!A1", "S!B1"), "error")), graph.getCircularRefs());
        assertFalse(graph.getExecutionOrder().contains("S!A1"));
        assertFalse(graph.getExecutionOrder().contains("S!B1"));
        assertTrue(graph.getExecutionOrder().contains("S!E1"));
        assertEquals(-1, graph.node("S!A1").orElseThrow().getDepth());
        assertTrue(graph.isCircular("S!B1"));
        assertEquals(2, graph.getClusters().size());
    }

    @Test
    @DisplayName("Should keep a range above the cap as one opaque node")
    void testBuild_ShouldKeepLargeRangesOpaque() {
        DependencyGraph graph = build(workbook("big.xlsx", sheet("S",
                formula("A1", "=SUM(B1:B2000)", 0))));

        assertEquals(2, graph.getNodes().size());
        GraphNode range = graph.node("S!B1:B2000").orElseThrow();
        assertTrue(range.isSynthesized());
        assertTrue(range.isOpaqueRange());
        assertEquals(List.of(new Edge("S!B1:B2000", "S!A1")), graph.getEdges());
        assertEquals(List.of(), graph.getClusters().get(0).getInputs());
        assertEquals(SemanticPurpose.AGGREGATION, graph.getClusters().get(0).getSemanticPurpose());
    }

    @Test
    @DisplayName("Should synthesize nodes for referenced blank cells")
    void testBuild_ShouldSynthesizeBlankReferences() {
        DependencyGraph graph = build(workbook("blank.xlsx", sheet("S",
                formula("A1", "=C3*2", 0))));

        GraphNode blank = graph.node("S!C3").orElseThrow();
        assertTrue(blank.isSynthesized());
        assertFalse(blank.isOpaqueRange());
        assertEquals(List.of("S!C3"), graph.getClusters().get(0).getInputs());
    }

    @Test
    @DisplayName("Should split unconnected calculations into separate clusters")
    void testBuild_ShouldFindSeparateClusters() {
        DependencyGraph graph = build(workbook("two.xlsx", sheet("S",
                value("A1", 1), formula("B1", "=A1*2", 2),
                value("D5", 3), formula("E5", "=D5+1", 4))));

        assertEquals(2, graph.getClusters().size());
        assertEquals("cluster_0", graph.getClusters().get(0).getId());
        assertEquals(List.of("S!A1", "S!B1"), graph.getClusters().get(0).getNodes());
        assertEquals("cluster_1", graph.getClusters().get(1).getId());
        assertEquals(List.of("S!D5", "S!E5"), graph.getClusters().get(1).getNodes());
    }
}
