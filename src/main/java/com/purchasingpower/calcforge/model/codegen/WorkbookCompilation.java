package com.purchasingpower.calcforge.model.codegen;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import lombok.Builder;
import lombok.Value;

/**
 * Results of all four stages for one workbook.
 */
@Value
@Builder
public class WorkbookCompilation {

    String workbookName;
    CellClassificationResult classification;
    DependencyGraph graph;
    LogicExtractionResult logic;
    GeneratedProject project;
}
