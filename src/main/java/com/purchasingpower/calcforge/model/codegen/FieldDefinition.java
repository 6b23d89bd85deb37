package com.purchasingpower.calcforge.model.codegen;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One input or output of the generated application, derived from a workbook cell.
 */
@Value
@Builder
public class FieldDefinition {

    /**
     * Identifier-safe address, e.g. {@code Loan_B3}.
     */
    String id;

    String address;

    String label;

    String section;

    String sheet;

    FieldType type;

    FieldKind kind;

    /**
     * Choices of an enumerated field; empty otherwise.
     */
    @Builder.Default
    List<String> options = List.of();

    /**
     * Calculation the field belongs to, null when the cell is in no cluster.
     */
    String calculationId;

    public String getColumnName() {
        return kind.getValue() + "_" + id;
    }
}
