package com.purchasingpower.calcforge.service.compiler;

import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.model.codegen.WorkbookCompilation;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;

import java.io.IOException;
import java.nio.file.Path;

public interface WorkbookCompilerService {

    /**
     * Reads the workbook export at {@code workbookPath} and runs every compilation step.
     */
    WorkbookCompilation compile(Path workbookPath);

    WorkbookCompilation compile(WorkbookStructure workbook);

    /**
     * Writes every generated file below {@code outputDir}, creating directories as needed.
     *
     * @return number of files written
     */
    int writeProject(GeneratedProject project, Path outputDir) throws IOException;
}
