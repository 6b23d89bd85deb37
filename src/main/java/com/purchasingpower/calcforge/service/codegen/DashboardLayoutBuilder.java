package com.purchasingpower.calcforge.service.codegen;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.classification.CellGroup;
import com.purchasingpower.calcforge.model.classification.SheetClassification;
import com.purchasingpower.calcforge.model.codegen.DashboardLayout;
import com.purchasingpower.calcforge.model.codegen.FieldDefinition;
import com.purchasingpower.calcforge.model.graph.CalculationCluster;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.graph.Edge;
import com.purchasingpower.calcforge.model.logic.BusinessRule;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.model.logic.RuleField;
import com.purchasingpower.calcforge.util.CellAddresses;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public final class DashboardLayoutBuilder {

    static final int MAX_KPIS = 6;

    private DashboardLayoutBuilder() {
    }

    public static DashboardLayout build(CellClassificationResult classification, DependencyGraph graph,
                                        LogicExtractionResult logic, FieldCatalog fields) {
        return DashboardLayout.builder()
                .title(Objects.toString(classification.getWorkbookName(), "Workbook"))
                .calculations(calculations(graph, logic))
                .sheetGroups(sheetGroups(classification, fields))
                .relationships(relationships(graph))
                .overview(fields.getOutputFields().stream()
                        .limit(MAX_KPIS)
                        .map(field -> new DashboardLayout.Kpi(field.getId(), field.getLabel(),
                                field.getType().getValue(), field.getCalculationId()))
                        .toList())
                .alerts(classification.getConditionalFormats().stream()
                        .map(format -> new DashboardLayout.Alert(format.getSheet(), format.getRange(), format.getRule(),
                                format.getSeverity().getValue(), format.getColor()))
                        .toList())
                .pivotTables(classification.getPivotTables().stream()
                        .map(pivot -> new DashboardLayout.PivotPanel(pivot.getName(), pivot.getSheet(),
                                pivot.getSourceRange(), pivot.getRowFields(), pivot.getColumnFields(),
                                pivot.getValueFields(), pivot.getFilterFields()))
                        .toList())
                .build();
    }

    /**
     * Rules ordered by the position of their first cell in the execution order.
     */
    public static List<BusinessRule> inExecutionOrder(DependencyGraph graph, LogicExtractionResult logic) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < graph.getExecutionOrder().size(); i++) {
            position.put(graph.getExecutionOrder().get(i), i);
        }
        Map<String, Integer> firstIndex = new HashMap<>();
        for (CalculationCluster cluster : graph.getClusters()) {
            int first = cluster.getNodes().stream()
                    .mapToInt(address -> position.getOrDefault(address, Integer.MAX_VALUE))
                    .min()
                    .orElse(Integer.MAX_VALUE);
            firstIndex.put(cluster.getId(), first);
        }
        return logic.getBusinessRules().stream()
                .sorted(Comparator.comparingInt(rule -> firstIndex.getOrDefault(rule.getId(), Integer.MAX_VALUE)))
                .toList();
    }

    private static List<DashboardLayout.CalculationPanel> calculations(DependencyGraph graph, LogicExtractionResult logic) {
        return inExecutionOrder(graph, logic).stream()
                .map(rule -> new DashboardLayout.CalculationPanel(
                        rule.getId(),
                        rule.getName(),
                        graph.getClusters().stream()
                                .filter(cluster -> cluster.getId().equals(rule.getId()) && cluster.getSemanticPurpose() != null)
                                .map(cluster -> cluster.getSemanticPurpose().getKey())
                                .findFirst()
                                .orElse(null),
                        rule.getInputs().stream().map(RuleField::getAddress).toList(),
                        rule.getOutputs().stream().map(RuleField::getAddress).toList(),
                        rule.isExecutable()))
                .toList();
    }

    private static List<DashboardLayout.SheetGroup> sheetGroups(CellClassificationResult classification, FieldCatalog fields) {
        Map<String, String> idByAddress = new HashMap<>();
        for (FieldDefinition field : fields.allFields()) {
            idByAddress.put(field.getAddress(), field.getId());
        }
        List<DashboardLayout.SheetGroup> groups = new ArrayList<>();
        for (SheetClassification sheet : classification.getSheets()) {
            sheet.getInputGroups().forEach(group -> groups.add(group(group, "input", idByAddress)));
            sheet.getOutputGroups().forEach(group -> groups.add(group(group, "output", idByAddress)));
        }
        return groups;
    }

    private static DashboardLayout.SheetGroup group(CellGroup group, String kind, Map<String, String> idByAddress) {
        List<String> ids = group.getCells().stream()
                .map(idByAddress::get)
                .filter(Objects::nonNull)
                .toList();
        return new DashboardLayout.SheetGroup(group.getName(), group.getSheet(), group.getSection(), kind, ids);
    }

    private static List<DashboardLayout.SheetRelationship> relationships(DependencyGraph graph) {
        Map<SheetPair, Integer> counts = new TreeMap<>(Comparator.comparing(SheetPair::from).thenComparing(SheetPair::to));
        for (Edge edge : graph.getEdges()) {
            String from = CellAddresses.sheetOf(edge.getSource());
            String to = CellAddresses.sheetOf(edge.getTarget());
            if (from != null && to != null && !from.equals(to)) {
                counts.merge(new SheetPair(from, to), 1, Integer::sum);
            }
        }
        List<DashboardLayout.SheetRelationship> relationships = new ArrayList<>();
        counts.forEach((pair, count) -> relationships.add(new DashboardLayout.SheetRelationship(pair.from(), pair.to(), count)));
        return relationships;
    }

    private record SheetPair(String from, String to) {
    }
}
