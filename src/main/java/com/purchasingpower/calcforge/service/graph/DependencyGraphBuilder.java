package com.purchasingpower.calcforge.service.graph;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;

/**
 * Second compiler stage: turns classified cells into a dependency graph with an
 * execution order, circular references and calculation clusters.
 */
public interface DependencyGraphBuilder {

    DependencyGraph build(CellClassificationResult classification);
}
