package com.purchasingpower.calcforge;

import com.purchasingpower.calcforge.configuration.CalcForgeProperties;
import com.purchasingpower.calcforge.formula.FormulaEvaluator;
import com.purchasingpower.calcforge.formula.FormulaParser;
import com.purchasingpower.calcforge.formula.FormulaTokenizer;
import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.formula.TypeInferencer;
import com.purchasingpower.calcforge.formula.TypeScriptTranslator;
import com.purchasingpower.calcforge.model.workbook.RawCell;
import com.purchasingpower.calcforge.model.workbook.SheetData;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import com.purchasingpower.calcforge.service.classification.impl.CellClassifierImpl;
import com.purchasingpower.calcforge.service.graph.impl.DependencyGraphBuilderImpl;
import com.purchasingpower.calcforge.service.logic.impl.LogicExtractorImpl;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Small workbooks and hand-wired compiler stages shared by the stage tests.
 */
public final class WorkbookFixtures {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);

    private WorkbookFixtures() {
    }

    public static RawCell value(String coordinate, Object value) {
        return RawCell.builder().coordinate(coordinate).value(value).build();
    }

    public static RawCell bold(String coordinate, String text) {
        return RawCell.builder().coordinate(coordinate).value(text).bold(true).build();
    }

    public static RawCell formatted(String coordinate, Object value, String numberFormat) {
        return RawCell.builder().coordinate(coordinate).value(value).numberFormat(numberFormat).build();
    }

    public static RawCell formula(String coordinate, String formula, Object cached) {
        return RawCell.builder().coordinate(coordinate).formula(formula).value(cached).build();
    }

    public static SheetData sheet(String name, RawCell... cells) {
        return SheetData.builder().name(name).cells(new ArrayList<>(List.of(cells))).build();
    }

    public static WorkbookStructure workbook(String fileName, SheetData... sheets) {
        return WorkbookStructure.builder().fileName(fileName).sheets(new ArrayList<>(List.of(sheets))).build();
    }

    /**
     * Simple interest calculator: three inputs, one intermediate, one output.
     */
    public static WorkbookStructure loanCalculator() {
        return workbook("loan.xlsx", sheet("Loan",
                bold("A1", "LOAN CALCULATOR"),
                value("A2", "Principal"), value("B2", 10000),
                value("A3", "Rate"), formatted("B3", 0.05, "0.00%"),
                value("A4", "Years"), value("B4", 10),
                value("A5", "Interest"), formula("B5", "=B2*B3*B4", 5000),
                value("A6", "Amount Due"), formula("B6", "=B2+B5", 15000)));
    }

    public static CalcForgeProperties properties() {
        return new CalcForgeProperties();
    }

    public static RangeExpander rangeExpander() {
        return new RangeExpander(properties().getRangeExpansionCap());
    }

    public static CellClassifierImpl classifier(RangeExpander expander) {
        return new CellClassifierImpl(properties(), new FormulaParser(new FormulaTokenizer(), expander), expander);
    }

    public static DependencyGraphBuilderImpl graphBuilder(RangeExpander expander) {
        return new DependencyGraphBuilderImpl(expander);
    }

    public static LogicExtractorImpl logicExtractor(RangeExpander expander) {
        return new LogicExtractorImpl(
                new FormulaParser(new FormulaTokenizer(), expander),
                new TypeInferencer(expander),
                new TypeScriptTranslator(expander),
                new FormulaEvaluator(expander, FIXED_CLOCK),
                expander);
    }
}
