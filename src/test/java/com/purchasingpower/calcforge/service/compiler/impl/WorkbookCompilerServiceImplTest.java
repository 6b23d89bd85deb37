package com.purchasingpower.calcforge.service.compiler.impl;

import com.purchasingpower.calcforge.model.codegen.FieldType;
import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.model.codegen.WorkbookCompilation;
import com.purchasingpower.calcforge.model.logic.BusinessRule;
import com.purchasingpower.calcforge.model.logic.FeatureKind;
import com.purchasingpower.calcforge.model.logic.TestCase;
import com.purchasingpower.calcforge.service.compiler.WorkbookCompilerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the four compiler stages through the Spring context on a JSON workbook export
 * and writes the generated project to disk.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Workbook Compiler Service Tests")
class WorkbookCompilerServiceImplTest {

    @Autowired
    private WorkbookCompilerService compilerService;

    @TempDir
    Path outputDir;

    private WorkbookCompilation compileLoanCalculator() throws IOException {
        Path export = new ClassPathResource("workbooks/loan-calculator.json").getFile().toPath();
        return compilerService.compile(export);
    }

    @Test
    @DisplayName("Should compile a workbook export through every stage")
    void testCompile_ShouldRunAllStages() throws IOException {
        WorkbookCompilation compilation = compileLoanCalculator();

        assertEquals("loan-calculator.xlsx", compilation.getWorkbookName());
        assertEquals(1, compilation.getClassification().getMacros().size());
        assertEquals(2, compilation.getGraph().getClusters().size());
        assertTrue(compilation.getGraph().getCircularRefs().isEmpty());

        BusinessRule amountDue = compilation.getLogic().findRule("cluster_0_amount_due").orElseThrow();
        assertTrue(amountDue.isExecutable());
        assertEquals(List.of("cluster_0_amount_due_default", "cluster_0_amount_due_seed_1",
                "cluster_0_amount_due_seed_2"), amountDue.getTestCases().stream().map(TestCase::getName).toList());
        assertEquals(Map.of("Loan!B5", 8.0, "Loan!B6", 10.0), amountDue.getTestCases().get(2).getExpected());

        BusinessRule lookup = compilation.getLogic().findRule("cluster_1_lookup").orElseThrow();
        assertFalse(lookup.isExecutable());
        assertEquals(FeatureKind.DYNAMIC_REFERENCE, compilation.getLogic().getUnsupportedFeatures().get(0).getKind());
    }

    @Test
    @DisplayName("Should resolve named ranges and currency formats into fields")
    void testCompile_ShouldBuildTypedFields() throws IOException {
        GeneratedProject project = compileLoanCalculator().getProject();

        assertEquals(List.of("Loan!B2", "Loan!B3", "Loan!B4"),
                project.getInputFields().stream().map(field -> field.getAddress()).toList());
        assertEquals(FieldType.CURRENCY, project.getInputFields().get(0).getType());
        assertEquals(FieldType.PERCENTAGE, project.getInputFields().get(1).getType());
        assertTrue(project.getRelationalSchema().contains("  output_Loan_B8 Float?"));
    }

    @Test
    @DisplayName("Should write every generated file under the output directory")
    void testWriteProject_ShouldWriteFiles() throws IOException {
        GeneratedProject project = compileLoanCalculator().getProject();

        int written = compilerService.writeProject(project, outputDir);

        assertEquals(project.getFiles().size(), written);
        assertTrue(Files.isRegularFile(outputDir.resolve("package.json")));
        assertTrue(Files.isRegularFile(outputDir.resolve(".gitignore")));
        String module = Files.readString(outputDir.resolve("src/lib/calculations/cluster_0_amount_due.ts"));
        assertTrue(module.contains("rt.round("));
    }

    @Test
    @DisplayName("Should refuse paths that escape the output directory")
    void testWriteProject_ShouldRejectEscapingPaths() {
        GeneratedProject project = GeneratedProject.builder()
                .projectName("evil")
                .files(Map.of("../outside.txt", "x"))
                .build();

        IOException error = assertThrows(IOException.class, () -> compilerService.writeProject(project, outputDir));
        assertTrue(error.getMessage().contains("escapes output directory"));
        assertFalse(Files.exists(outputDir.getParent().resolve("outside.txt")));
    }
}
