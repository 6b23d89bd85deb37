package com.purchasingpower.calcforge.service.codegen;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.classification.CellRole;
import com.purchasingpower.calcforge.model.classification.ClassifiedCell;
import com.purchasingpower.calcforge.model.classification.DataValidation;
import com.purchasingpower.calcforge.model.codegen.FieldDefinition;
import com.purchasingpower.calcforge.model.codegen.FieldKind;
import com.purchasingpower.calcforge.model.codegen.FieldType;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.graph.GraphNode;
import com.purchasingpower.calcforge.model.logic.BusinessRule;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.model.logic.ValueType;
import com.purchasingpower.calcforge.service.classification.LabelLocator;
import com.purchasingpower.calcforge.util.CellAddresses;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Input and output fields of the generated application, one per input and output cell
 * of a calculation, in graph order.
 */
@Getter
public class FieldCatalog {

    private final List<FieldDefinition> inputFields;
    private final List<FieldDefinition> outputFields;

    public FieldCatalog(CellClassificationResult classification, DependencyGraph graph, LogicExtractionResult logic) {
        LabelLocator labels = new LabelLocator(classification);
        Map<String, ClassifiedCell> cells = classification.cellsByAddress();
        Map<String, ValueType> inputTypes = new HashMap<>();
        Map<String, ValueType> outputTypes = new HashMap<>();
        for (BusinessRule rule : logic.getBusinessRules()) {
            rule.getInputs().forEach(field -> inputTypes.merge(field.getAddress(), field.getType(), ValueType::unify));
            rule.getOutputs().forEach(field -> outputTypes.put(field.getAddress(), field.getType()));
        }

        List<FieldDefinition> inputs = new ArrayList<>();
        List<FieldDefinition> outputs = new ArrayList<>();
        for (GraphNode node : graph.getNodes().values()) {
            if (node.getClusterId() == null || node.isOpaqueRange()) {
                continue;
            }
            if (node.getRole() == CellRole.INPUT) {
                inputs.add(field(node, FieldKind.INPUT, inputTypes.get(node.getAddress()), cells.get(node.getAddress()), labels));
            } else if (node.getRole() == CellRole.FORMULA_OUTPUT) {
                outputs.add(field(node, FieldKind.OUTPUT, outputTypes.get(node.getAddress()), cells.get(node.getAddress()), labels));
            }
        }
        this.inputFields = List.copyOf(inputs);
        this.outputFields = List.copyOf(outputs);
    }

    private static FieldDefinition field(GraphNode node, FieldKind kind, ValueType inferred, ClassifiedCell cell,
                                         LabelLocator labels) {
        DataValidation validation = cell == null ? null : cell.getValidation();
        FieldType type = FieldType.of(inferred, cell == null ? null : cell.getInputType());
        List<String> options = List.of();
        if (validation != null && validation.isEnumeration()) {
            type = FieldType.ENUM;
            options = validation.getOptions();
        }
        String label = labels.labelFor(node.getAddress())
                .map(text -> text.trim().replaceAll(":+$", "").trim())
                .filter(text -> !text.isEmpty())
                .orElse(node.getAddress());
        return FieldDefinition.builder()
                .id(CellAddresses.toIdentifier(node.getAddress()))
                .address(node.getAddress())
                .label(label)
                .section(labels.sectionFor(node.getAddress()))
                .sheet(node.getSheet())
                .type(type)
                .kind(kind)
                .options(options)
                .calculationId(node.getClusterId())
                .build();
    }

    /**
     * Input fields first, then outputs.
     */
    public List<FieldDefinition> allFields() {
        List<FieldDefinition> all = new ArrayList<>(inputFields);
        all.addAll(outputFields);
        return all;
    }
}
