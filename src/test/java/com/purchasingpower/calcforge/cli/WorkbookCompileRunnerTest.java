package com.purchasingpower.calcforge.cli;

import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.model.codegen.WorkbookCompilation;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import com.purchasingpower.calcforge.service.compiler.WorkbookCompilerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.purchasingpower.calcforge.WorkbookFixtures.properties;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Workbook Compile Runner Tests")
class WorkbookCompileRunnerTest {

    private RecordingCompilerService compilerService;
    private WorkbookCompileRunner runner;

    @BeforeEach
    void setUp() {
        compilerService = new RecordingCompilerService();
        runner = new WorkbookCompileRunner(compilerService, properties());
    }

    @Test
    @DisplayName("Should compile the workbook and write to the given output directory")
    void testRun_ShouldCompileAndWrite() throws Exception {
        runner.run(new DefaultApplicationArguments("--workbook=book.json", "--output=out/app"));

        assertEquals(List.of(Path.of("book.json")), compilerService.compiled);
        assertEquals(List.of(Path.of("out/app")), compilerService.written);
    }

    @Test
    @DisplayName("Should fall back to the configured output directory")
    void testRun_ShouldUseDefaultOutputDir() throws Exception {
        runner.run(new DefaultApplicationArguments("--workbook=book.json"));

        assertEquals(List.of(Path.of("generated-app")), compilerService.written);
    }

    @Test
    @DisplayName("Should do nothing without a workbook option")
    void testRun_ShouldSkipWithoutWorkbook() throws Exception {
        runner.run(new DefaultApplicationArguments("--output=out"));

        assertTrue(compilerService.compiled.isEmpty());
        assertTrue(compilerService.written.isEmpty());
    }

    private static class RecordingCompilerService implements WorkbookCompilerService {

        private final List<Path> compiled = new ArrayList<>();
        private final List<Path> written = new ArrayList<>();

        @Override
        public WorkbookCompilation compile(Path workbookPath) {
            compiled.add(workbookPath);
            return WorkbookCompilation.builder()
                    .workbookName(workbookPath.toString())
                    .logic(LogicExtractionResult.builder().build())
                    .project(GeneratedProject.builder().projectName("excel-app").build())
                    .build();
        }

        @Override
        public WorkbookCompilation compile(WorkbookStructure workbook) {
            throw new UnsupportedOperationException("Only path compilation is exercised here");
        }

        @Override
        public int writeProject(GeneratedProject project, Path outputDir) {
            written.add(outputDir);
            return project.getFiles().size();
        }
    }
}
