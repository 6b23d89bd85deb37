package com.purchasingpower.calcforge.service.logic.impl;

import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.model.logic.BusinessRule;
import com.purchasingpower.calcforge.model.logic.CalculationUnit;
import com.purchasingpower.calcforge.model.logic.FeatureKind;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.model.logic.RuleField;
import com.purchasingpower.calcforge.model.logic.TestCase;
import com.purchasingpower.calcforge.model.logic.UnsupportedFeature;
import com.purchasingpower.calcforge.model.logic.ValueType;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import com.purchasingpower.calcforge.service.classification.impl.CellClassifierImpl;
import com.purchasingpower.calcforge.service.graph.impl.DependencyGraphBuilderImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.purchasingpower.calcforge.WorkbookFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Logic Extractor Tests")
class LogicExtractorImplTest {

    private CellClassifierImpl classifier;
    private DependencyGraphBuilderImpl graphBuilder;
    private LogicExtractorImpl extractor;

    @BeforeEach
    void setUp() {
        RangeExpander expander = rangeExpander();
        classifier = classifier(expander);
        graphBuilder = graphBuilder(expander);
        extractor = logicExtractor(expander);
    }

    private LogicExtractionResult extract(WorkbookStructure workbook) {
        return extractor.extract(graphBuilder.build(classifier.classify(workbook)));
    }

    // ======================================================================
    // EXECUTABLE CALCULATIONS
    // ======================================================================

    @Test
    @DisplayName("Should describe a labelled cluster as a typed business rule")
    void testExtract_ShouldBuildBusinessRule() {
        LogicExtractionResult result = extract(loanCalculator());

        BusinessRule rule = result.findRule("cluster_0_amount_due").orElseThrow();
        assertEquals("Amount Due", rule.getName());
        assertEquals("Auto-extracted calculation cluster", rule.getDescription());
        assertTrue(rule.isExecutable());
        assertTrue(rule.getConstraints().isEmpty());
        assertEquals(List.of(new RuleField("Loan!B2", ValueType.NUMBER), new RuleField("Loan!B3", ValueType.NUMBER),
                new RuleField("Loan!B4", ValueType.NUMBER)), rule.getInputs());
        assertEquals(List.of(new RuleField("Loan!B6", ValueType.NUMBER)), rule.getOutputs());
        assertEquals("Loan!B5 = =B2*B3*B4\nLoan!B6 = =B2+B5", rule.getLogic().getPseudocode());
        assertEquals("z.object({\"Loan!B2\": z.number(), \"Loan!B3\": z.number(), \"Loan!B4\": z.number()})",
                rule.getLogic().getValidationSchema());
    }

    @Test
    @DisplayName("Should emit the calculation function in execution order")
    void testExtract_ShouldWriteCalculationFunction() {
        BusinessRule rule = extract(loanCalculator()).getBusinessRules().get(0);

        String typescript = rule.getLogic().getTypescript();
        assertTrue(typescript.startsWith("export const calculate_cluster_0_amount_due: CalculationFn = (inputs) => {"));
        int interest = typescript.indexOf("computed[\"Loan!B5\"] = rt.result(");
        int amountDue = typescript.indexOf("computed[\"Loan!B6\"] = rt.result(");
        assertTrue(interest > 0);
        assertTrue(amountDue > interest);
        assertTrue(typescript.contains("(rt.num(ref(\"Loan!B2\")) + rt.num(ref(\"Loan!B5\")))"));
    }

    @Test
    @DisplayName("Should seed test cases and pin evaluator results")
    void testExtract_ShouldSynthesizeTestCases() {
        LogicExtractionResult result = extract(workbook("chain.xlsx", sheet("S",
                value("A1", 4), value("B1", 6), formula("C1", "=A1+B1", 10), formula("D1", "=C1+10", 20))));

        List<TestCase> cases = result.getTestSuite();
        assertEquals(List.of("cluster_0_default", "cluster_0_seed_1", "cluster_0_seed_10"),
                cases.stream().map(TestCase::getName).toList());
        assertEquals(Map.of("S!C1", 0.0, "S!D1", 10.0), cases.get(0).getExpected());
        assertEquals(Map.of("S!C1", 2.0, "S!D1", 12.0), cases.get(1).getExpected());
        assertEquals(Map.of("S!A1", 10.0, "S!B1", 10.0), cases.get(2).getInputs());
        assertEquals(Map.of("S!C1", 20.0, "S!D1", 30.0), cases.get(2).getExpected());
        assertEquals("Calculation 0", result.getBusinessRules().get(0).getName());
    }

    @Test
    @DisplayName("Should drop only the failing seeds when a formula leaves the date range")
    void testExtract_ShouldIsolateEvaluationFailures() {
        LogicExtractionResult result = extract(workbook("dates.xlsx", sheet("S",
                value("A1", 5), formula("B1", "=A1*2", 10),
                value("D1", 1), formula("E1", "=YEAR(D1*1E12)", 0))));

        BusinessRule healthy = result.findRule("cluster_0").orElseThrow();
        BusinessRule overflowing = result.findRule("cluster_1").orElseThrow();
        assertEquals(List.of("cluster_0_default", "cluster_0_seed_1", "cluster_0_seed_2"),
                healthy.getTestCases().stream().map(TestCase::getName).toList());
        assertEquals(Map.of("S!B1", 4.0), healthy.getTestCases().get(2).getExpected());
        assertEquals(List.of("cluster_1_default"),
                overflowing.getTestCases().stream().map(TestCase::getName).toList());
        assertTrue(overflowing.isExecutable());
    }

    @Test
    @DisplayName("Should list calculation units with inputs read from outside the unit")
    void testExtract_ShouldBuildCalculationUnits() {
        LogicExtractionResult result = extract(loanCalculator());

        CalculationUnit unit = result.getCalculations().get(0);
        assertEquals("cluster_0_amount_due", unit.getId());
        assertEquals(List.of("Loan!B5", "Loan!B6"), unit.getFormulas().stream().map(f -> f.getTarget()).toList());
        assertEquals(List.of("Loan!B2", "Loan!B3", "Loan!B4"), unit.getInputs());
        assertEquals(List.of("Loan!B6"), unit.getOutputs());
    }

    // ======================================================================
    // UNSUPPORTED FEATURES
    // ======================================================================

    @Test
    @DisplayName("Should flag dynamic references once and stub only their cluster")
    void testExtract_ShouldStubDynamicReferences() {
        LogicExtractionResult result = extract(workbook("dynamic.xlsx", sheet("S",
                value("A1", 4), value("B1", 6), formula("C1", "=A1+B1", 10),
                formula("E3", "=INDIRECT(\"A1\")*2", 8))));

        List<UnsupportedFeature> features = result.getUnsupportedFeatures();
        assertEquals(1, features.size());
        assertEquals(FeatureKind.DYNAMIC_REFERENCE, features.get(0).getKind());
        assertEquals("S!E3", features.get(0).getCellAddress());
        assertEquals("INDIRECT", features.get(0).getDetail());

        BusinessRule healthy = result.findRule("cluster_0").orElseThrow();
        BusinessRule dynamic = result.findRule("cluster_1").orElseThrow();
        assertTrue(healthy.isExecutable());
        assertFalse(dynamic.isExecutable());
        assertEquals(List.of("Unsupported function: INDIRECT"), dynamic.getConstraints());
        assertTrue(dynamic.getLogic().getTypescript().contains("throw new Error("));
        assertTrue(dynamic.getTestCases().isEmpty());
        assertEquals(2, healthy.getTestCases().size());
    }

    @Test
    @DisplayName("Should record unsupported functions as features and constraints")
    void testExtract_ShouldFlagUnsupportedFunctions() {
        LogicExtractionResult result = extract(workbook("npv.xlsx", sheet("S",
                value("A1", 0.1), value("A2", 100), formula("B1", "=NPV(A1,A2)", 90.9))));

        assertEquals(FeatureKind.UNSUPPORTED_FUNCTION, result.getUnsupportedFeatures().get(0).getKind());
        BusinessRule rule = result.getBusinessRules().get(0);
        assertFalse(rule.isExecutable());
        assertEquals(List.of("Unsupported function: NPV"), rule.getConstraints());
    }

    @Test
    @DisplayName("Should stub circular calculations and report the cycle")
    void testExtract_ShouldStubCircularReferences() {
        LogicExtractionResult result = extract(workbook("cycle.xlsx", sheet("S",
                formula("A1", "=B1+1", 0), formula("B1", "=A1+1", 0))));

        UnsupportedFeature cycle = result.getUnsupportedFeatures().stream()
                .filter(feature -> feature.getKind() == FeatureKind.CIRCULAR_REFERENCE)
                .findFirst()
                .orElseThrow();
        assertEquals("S!A1, S!B1", cycle.getDetail());

        BusinessRule rule = result.getBusinessRules().get(0);
        assertFalse(rule.isExecutable());
        assertEquals(List.of("Circular reference among: S!A1, S!B1"), rule.getConstraints());
        assertEquals(List.of(new RuleField("S!A1", ValueType.NUMBER), new RuleField("S!B1", ValueType.NUMBER)),
                rule.getOutputs());
    }

    @Test
    @DisplayName("Should keep opaque ranges out of rule inputs and mark the rule non-executable")
    void testExtract_ShouldReportOpaqueRanges() {
        LogicExtractionResult result = extract(workbook("big.xlsx", sheet("S",
                formula("A1", "=SUM(B1:B2000)", 0))));

        BusinessRule rule = result.getBusinessRules().get(0);
        assertTrue(rule.getInputs().isEmpty());
        assertFalse(rule.isExecutable());
        assertEquals(List.of("S!A1: Range S!B1:B2000 exceeds the 1000-cell expansion limit"), rule.getConstraints());
        assertTrue(rule.getLogic().getTypescript().contains("rt.unsupportedRange(\"S!B1:B2000\")"));
    }
}
