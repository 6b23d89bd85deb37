package com.purchasingpower.calcforge.service.codegen.impl;

import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.codegen.FieldDefinition;
import com.purchasingpower.calcforge.model.codegen.FieldKind;
import com.purchasingpower.calcforge.model.codegen.FieldType;
import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import com.purchasingpower.calcforge.service.codegen.CodeGenerationRequest;
import com.purchasingpower.calcforge.service.codegen.TemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.calcforge.WorkbookFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Code Generator Tests")
class CodeGeneratorImplTest {

    private RangeExpander expander;
    private CodeGeneratorImpl generator;

    @BeforeEach
    void setUp() {
        expander = rangeExpander();
        generator = new CodeGeneratorImpl(new TemplateRenderer(), properties());
    }

    private GeneratedProject generate(WorkbookStructure workbook) {
        CellClassificationResult classification = classifier(expander).classify(workbook);
        DependencyGraph graph = graphBuilder(expander).build(classification);
        LogicExtractionResult logic = logicExtractor(expander).extract(graph);
        return generator.generate(CodeGenerationRequest.builder()
                .classification(classification)
                .graph(graph)
                .logic(logic)
                .build());
    }

    @Test
    @DisplayName("Should emit the full application file set")
    void testGenerate_ShouldEmitProjectFiles() {
        GeneratedProject project = generate(loanCalculator());

        for (String path : List.of(
                "package.json", "tsconfig.json", "next.config.js", ".gitignore", "README.md",
                "prisma/schema.prisma", "src/lib/prisma.ts", "src/lib/inputs.ts", "src/lib/uiDesigner.ts",
                "src/lib/calculations/index.ts", "src/lib/calculations/runtime.ts", "src/lib/calculations/types.ts",
                "src/lib/calculations/cluster_0_amount_due.ts",
                "src/app/layout.tsx", "src/app/page.tsx", "src/app/api/calculate/route.ts",
                "src/app/api/scenarios/route.ts", "src/components/InputForm.tsx",
                "__tests__/calculations.test.ts")) {
            assertTrue(project.file(path).isPresent(), () -> "Missing generated file " + path);
        }
        assertEquals("excel-app", project.getProjectName());
    }

    @Test
    @DisplayName("Should declare dependencies and scripts in package.json")
    void testGenerate_ShouldWritePackageJson() {
        GeneratedProject project = generate(loanCalculator());

        String packageJson = project.file("package.json").orElseThrow();
        assertTrue(packageJson.contains("\"excel-app\""));
        assertTrue(packageJson.contains("\"vitest run\""));
        assertTrue(packageJson.contains("\"zod\""));
        assertEquals("3.23.8", project.getDependencies().get("zod"));
        assertEquals("5.4.5", project.getDevDependencies().get("typescript"));
    }

    @Test
    @DisplayName("Should add one nullable column per input and output field")
    void testGenerate_ShouldWriteRelationalSchema() {
        GeneratedProject project = generate(loanCalculator());

        String schema = project.getRelationalSchema();
        assertEquals(schema, project.file("prisma/schema.prisma").orElseThrow());
        assertTrue(schema.contains("model Scenario {"));
        assertTrue(schema.contains("  input_Loan_B2 Float?"));
        assertTrue(schema.contains("  input_Loan_B3 Float?"));
        assertTrue(schema.contains("  output_Loan_B6 Float?"));
        assertFalse(schema.contains("Loan_B5"));
    }

    @Test
    @DisplayName("Should describe fields with labels, sections and refined types")
    void testGenerate_ShouldBuildFieldDefinitions() {
        GeneratedProject project = generate(loanCalculator());

        assertEquals(List.of("Loan!B2", "Loan!B3", "Loan!B4"),
                project.getInputFields().stream().map(FieldDefinition::getAddress).toList());
        FieldDefinition rate = project.getInputFields().get(1);
        assertEquals("Rate", rate.getLabel());
        assertEquals("LOAN CALCULATOR", rate.getSection());
        assertEquals(FieldType.PERCENTAGE, rate.getType());
        assertEquals(FieldKind.INPUT, rate.getKind());
        assertEquals("cluster_0_amount_due", rate.getCalculationId());

        FieldDefinition amountDue = project.getOutputFields().get(0);
        assertEquals("Amount Due", amountDue.getLabel());
        assertEquals("output_Loan_B6", amountDue.getColumnName());
    }

    @Test
    @DisplayName("Should wrap each calculation in its own module and register it in the index")
    void testGenerate_ShouldWriteCalculationModules() {
        GeneratedProject project = generate(loanCalculator());

        String module = project.file("src/lib/calculations/cluster_0_amount_due.ts").orElseThrow();
        assertTrue(module.contains("import * as rt from \"./runtime\";"));
        assertTrue(module.contains("export const calculate_cluster_0_amount_due: CalculationFn"));
        assertFalse(module.contains("&quot;"));

        String index = project.file("src/lib/calculations/index.ts").orElseThrow();
        assertTrue(index.contains("import { calculate_cluster_0_amount_due } from \"./cluster_0_amount_due\";"));
        assertTrue(index.contains("\"cluster_0_amount_due\": calculate_cluster_0_amount_due,"));
    }

    @Test
    @DisplayName("Should build zod schemas for inputs and outputs")
    void testGenerate_ShouldWriteSchemas() {
        String inputs = generate(loanCalculator()).file("src/lib/inputs.ts").orElseThrow();

        assertTrue(inputs.contains("\"Loan!B2\": z.coerce.number().optional(),"));
        assertTrue(inputs.contains("\"Loan!B6\": z.number().optional(),"));
    }

    @Test
    @DisplayName("Should embed test cases and skip non-executable calculations")
    void testGenerate_ShouldWriteTestSuite() {
        GeneratedProject project = generate(workbook("dynamic.xlsx", sheet("S",
                value("A1", 4), value("B1", 6), formula("C1", "=A1+B1", 10),
                formula("E3", "=INDIRECT(\"A1\")*2", 8))));

        String tests = project.file("__tests__/calculations.test.ts").orElseThrow();
        assertTrue(tests.contains("cluster_0_default"));
        assertTrue(tests.contains("it.skip(\"cluster_1: Unsupported function: INDIRECT\""));
        assertEquals(2, project.getTestSuite().size());

        String stub = project.file("src/lib/calculations/cluster_1.ts").orElseThrow();
        assertTrue(stub.contains("throw new Error("));
        assertTrue(project.file("README.md").orElseThrow().contains("INDIRECT"));
    }
}
