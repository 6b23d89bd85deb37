package com.purchasingpower.calcforge.model.codegen;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Layout hints for the generated dashboard, written to {@code src/lib/uiDesigner.ts} as JSON.
 */
@Value
@Builder
public class DashboardLayout {

    String title;

    /**
     * Calculations in execution order.
     */
    @Builder.Default
    List<CalculationPanel> calculations = List.of();

    @Builder.Default
    List<SheetGroup> sheetGroups = List.of();

    @Builder.Default
    List<SheetRelationship> relationships = List.of();

    @Builder.Default
    List<Kpi> overview = List.of();

    @Builder.Default
    List<Alert> alerts = List.of();

    @Builder.Default
    List<PivotPanel> pivotTables = List.of();

    public record CalculationPanel(String id, String name, String purpose, List<String> inputs,
                                   List<String> outputs, boolean executable) {
    }

    public record SheetGroup(String name, String sheet, String section, String kind, List<String> fields) {
    }

    /**
     * Formulas on {@code toSheet} read {@code references} cells of {@code fromSheet}.
     */
    public record SheetRelationship(String fromSheet, String toSheet, int references) {
    }

    public record Kpi(String fieldId, String label, String type, String calculationId) {
    }

    public record Alert(String sheet, String range, String rule, String severity, String color) {
    }

    public record PivotPanel(String name, String sheet, String sourceRange, List<String> rowFields,
                             List<String> columnFields, List<String> valueFields, List<String> filterFields) {
    }
}
