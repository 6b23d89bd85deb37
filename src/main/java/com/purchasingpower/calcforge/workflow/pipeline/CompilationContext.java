package com.purchasingpower.calcforge.workflow.pipeline;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import lombok.Data;

/**
 * State carried through the compilation steps. Each step reads its predecessor's
 * result through a {@code require*} accessor and stores its own.
 */
@Data
public class CompilationContext {

    private final WorkbookStructure workbook;

    private CellClassificationResult classification;
    private DependencyGraph graph;
    private LogicExtractionResult logic;
    private GeneratedProject project;

    public CompilationContext(WorkbookStructure workbook) {
        this.workbook = workbook;
    }

    public String getWorkbookName() {
        return workbook == null ? null : workbook.getFileName();
    }

    public WorkbookStructure requireWorkbook() {
        return require(workbook, "workbook");
    }

    public CellClassificationResult requireClassification() {
        return require(classification, "cell classification");
    }

    public DependencyGraph requireGraph() {
        return require(graph, "dependency graph");
    }

    public LogicExtractionResult requireLogic() {
        return require(logic, "logic extraction");
    }

    public GeneratedProject requireProject() {
        return require(project, "generated project");
    }

    private static <T> T require(T value, String what) {
        if (value == null) {
            throw new IllegalStateException("Compilation step ran before " + what + " was available");
        }
        return value;
    }
}
