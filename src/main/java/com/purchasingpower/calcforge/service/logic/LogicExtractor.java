package com.purchasingpower.calcforge.service.logic;

import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;

/**
 * Third compiler stage: parses every formula and turns each cluster into a typed,
 * tested business rule.
 *
 * <p>Unsupported constructs are recorded as {@link com.purchasingpower.calcforge.model.logic.UnsupportedFeature}s
 * and never stop extraction of other clusters.
 */
public interface LogicExtractor {

    LogicExtractionResult extract(DependencyGraph graph);
}
