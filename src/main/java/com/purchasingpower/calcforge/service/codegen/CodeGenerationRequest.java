package com.purchasingpower.calcforge.service.codegen;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything code generation reads: the results of the three earlier stages.
 */
@Value
@Builder
public class CodeGenerationRequest {

    @NonNull
    CellClassificationResult classification;

    @NonNull
    DependencyGraph graph;

    @NonNull
    LogicExtractionResult logic;
}
