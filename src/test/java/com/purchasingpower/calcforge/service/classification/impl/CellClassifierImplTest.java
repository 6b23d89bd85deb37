package com.purchasingpower.calcforge.service.classification.impl;

import com.purchasingpower.calcforge.exception.WorkbookReadException;
import com.purchasingpower.calcforge.model.classification.AlertSeverity;
import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.classification.CellGroup;
import com.purchasingpower.calcforge.model.classification.CellRole;
import com.purchasingpower.calcforge.model.classification.ClassifiedCell;
import com.purchasingpower.calcforge.model.classification.ConditionalFormat;
import com.purchasingpower.calcforge.model.classification.InputType;
import com.purchasingpower.calcforge.model.classification.SheetClassification;
import com.purchasingpower.calcforge.model.classification.SheetSection;
import com.purchasingpower.calcforge.model.workbook.NamedRange;
import com.purchasingpower.calcforge.model.workbook.RawConditionalFormat;
import com.purchasingpower.calcforge.model.workbook.RawValidation;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.calcforge.WorkbookFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cell Classifier Tests")
class CellClassifierImplTest {

    private CellClassifierImpl classifier;

    @BeforeEach
    void setUp() {
        classifier = classifier(rangeExpander());
    }

    private static ClassifiedCell cell(CellClassificationResult result, String address) {
        return result.findCell(address).orElseThrow(() -> new AssertionError("No cell " + address));
    }

    // ======================================================================
    // ROLES
    // ======================================================================

    @Test
    @DisplayName("Should assign input, intermediate and output roles from references")
    void testClassify_ShouldAssignCalculationRoles() {
        CellClassificationResult result = classifier.classify(loanCalculator());

        assertEquals(CellRole.INPUT, cell(result, "Loan!B2").getRole());
        assertEquals(CellRole.INPUT, cell(result, "Loan!B3").getRole());
        assertEquals(CellRole.FORMULA_INTERMEDIATE, cell(result, "Loan!B5").getRole());
        assertEquals(CellRole.FORMULA_OUTPUT, cell(result, "Loan!B6").getRole());
        assertEquals(List.of("Loan!B2", "Loan!B3", "Loan!B4"), cell(result, "Loan!B5").getReferences());
        assertEquals(List.of("Loan!B5", "Loan!B6"), cell(result, "Loan!B2").getReferencedBy());
    }

    @Test
    @DisplayName("Should tell headings from labels")
    void testClassify_ShouldFindHeadingsAndLabels() {
        CellClassificationResult result = classifier.classify(loanCalculator());

        assertEquals(CellRole.STRUCTURAL, cell(result, "Loan!A1").getRole());
        assertEquals(CellRole.LABEL, cell(result, "Loan!A2").getRole());
        assertEquals(CellRole.LABEL, cell(result, "Loan!A6").getRole());
        assertEquals("Amount Due", cell(result, "Loan!A6").getLabel());
    }

    @Test
    @DisplayName("Should leave text away from calculations static")
    void testClassify_ShouldKeepDistantTextStatic() {
        WorkbookStructure workbook = workbook("notes.xlsx", sheet("S",
                value("A1", 1), value("B1", 2), formula("C1", "=A1+B1", 3),
                value("A5", "note"), value("B5", 7)));

        CellClassificationResult result = classifier.classify(workbook);

        assertEquals(CellRole.STATIC, cell(result, "S!A5").getRole());
        assertEquals(CellRole.STATIC, cell(result, "S!B5").getRole());
    }

    @Test
    @DisplayName("Should infer percentage inputs from the number format")
    void testClassify_ShouldInferInputTypeFromFormat() {
        CellClassificationResult result = classifier.classify(loanCalculator());

        assertEquals(InputType.PERCENTAGE, cell(result, "Loan!B3").getInputType());
        assertEquals(InputType.NUMBER, cell(result, "Loan!B2").getInputType());
    }

    // ======================================================================
    // SECTIONS AND GROUPS
    // ======================================================================

    @Test
    @DisplayName("Should split sheets into sections under headings and group inputs and outputs")
    void testClassify_ShouldBuildSectionsAndGroups() {
        SheetClassification sheet = classifier.classify(loanCalculator()).findSheet("Loan").orElseThrow();

        assertEquals(List.of(new SheetSection("LOAN CALCULATOR", "Loan!A1", 2, 6)), sheet.getSections());
        assertEquals(List.of(new CellGroup("Loan - General Inputs", "Loan", "General",
                List.of("Loan!B2", "Loan!B3", "Loan!B4"))), sheet.getInputGroups());
        assertEquals(List.of(new CellGroup("Loan - LOAN CALCULATOR Outputs", "Loan", "LOAN CALCULATOR",
                List.of("Loan!B6"))), sheet.getOutputGroups());
        assertEquals(6, sheet.getMaxRow());
        assertEquals(2, sheet.getMaxColumn());
    }

    // ======================================================================
    // WORKBOOK-LEVEL FACTS
    // ======================================================================

    @Test
    @DisplayName("Should resolve named ranges used in formulas")
    void testClassify_ShouldResolveNamedRanges() {
        WorkbookStructure workbook = loanCalculator();
        workbook.getSheets().get(0).getCells().add(formula("B8", "=Principal*2", 20000));
        workbook.getNamedRanges().add(new NamedRange("Principal", "Loan!$B$2"));

        CellClassificationResult result = classifier.classify(workbook);

        assertEquals("Loan!B2", result.getNamedRanges().get("PRINCIPAL"));
        assertEquals(List.of("Loan!B2"), cell(result, "Loan!B8").getReferences());
        assertTrue(cell(result, "Loan!B2").getReferencedBy().contains("Loan!B8"));
    }

    @Test
    @DisplayName("Should turn list validations into enumerated inputs")
    void testClassify_ShouldResolveListValidation() {
        WorkbookStructure workbook = workbook("plans.xlsx", sheet("Form",
                value("A1", "Plan"), value("B1", "Basic"),
                value("A2", "Fee"), formula("B2", "=IF(B1=\"Premium\",20,10)", 10)));
        workbook.getDataValidations().add(RawValidation.builder()
                .ranges("B1")
                .type("list")
                .formula1("\"Basic,Premium\"")
                .build());

        ClassifiedCell plan = cell(classifier.classify(workbook), "Form!B1");

        assertEquals(CellRole.INPUT, plan.getRole());
        assertEquals(InputType.ENUM, plan.getInputType());
        assertEquals(List.of("Basic", "Premium"), plan.getValidation().getOptions());
        assertEquals("Form", plan.getValidation().getSheet());
    }

    @Test
    @DisplayName("Should read a quoted single-option list as an inline option")
    void testClassify_ShouldResolveSingleOptionList() {
        WorkbookStructure workbook = workbook("consent.xlsx", sheet("Form",
                value("A1", "Agree"), value("B1", "Yes"),
                value("A2", "Flag"), formula("B2", "=IF(B1=\"Yes\",1,0)", 1)));
        workbook.getDataValidations().add(RawValidation.builder()
                .ranges("B1")
                .type("list")
                .formula1("\"Yes\"")
                .build());

        ClassifiedCell agree = cell(classifier.classify(workbook), "Form!B1");

        assertEquals(List.of("Yes"), agree.getValidation().getOptions());
        assertTrue(agree.getValidation().isEnumeration());
        assertEquals(InputType.ENUM, agree.getInputType());
    }

    @Test
    @DisplayName("Should derive alert severity from the rule or its color")
    void testClassify_ShouldResolveConditionalFormatSeverity() {
        WorkbookStructure workbook = loanCalculator();
        workbook.getConditionalFormats().add(RawConditionalFormat.builder()
                .range("B6").type("cellIs").formula("B6>20000").color("FFFF0000").build());
        workbook.getConditionalFormats().add(RawConditionalFormat.builder()
                .range("B5").type("expression").color("FFFFA500").build());
        workbook.getConditionalFormats().add(RawConditionalFormat.builder()
                .range("B2").color("FFFF0000").severity("info").build());

        List<ConditionalFormat> formats = classifier.classify(workbook).getConditionalFormats();

        assertEquals(3, formats.size());
        assertEquals(AlertSeverity.ERROR, formats.get(0).getSeverity());
        assertEquals("Loan!B6", formats.get(0).getRange());
        assertEquals("cellIs:B6>20000", formats.get(0).getRule());
        assertEquals(AlertSeverity.WARNING, formats.get(1).getSeverity());
        assertEquals("expression", formats.get(1).getRule());
        assertEquals(AlertSeverity.INFO, formats.get(2).getSeverity());
    }

    @Test
    @DisplayName("Should reject a workbook without sheets")
    void testClassify_ShouldRejectEmptyWorkbook() {
        WorkbookStructure empty = WorkbookStructure.builder().fileName("empty.xlsx").build();

        WorkbookReadException error = assertThrows(WorkbookReadException.class, () -> classifier.classify(empty));
        assertTrue(error.getMessage().contains("no sheets"));
    }
}
