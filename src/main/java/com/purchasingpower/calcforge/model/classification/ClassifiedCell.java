package com.purchasingpower.calcforge.model.classification;

import com.purchasingpower.calcforge.util.CellPosition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A non-empty workbook cell together with its role in the calculation.
 */
@Value
@Builder
public class ClassifiedCell {

    /**
     * Qualified address, e.g. {@code Sheet1!B12}.
     */
    String address;

    String sheet;

    int row;

    int column;

    CellRole role;

    /**
     * Formula text including the leading {@code =}; null for literal cells.
     */
    String formula;

    Object value;

    InputType inputType;

    CellFormatting formatting;

    DataValidation validation;

    /**
     * Trimmed text of label and structural cells.
     */
    String label;

    /**
     * Addresses this cell's formula reads, ranges expanded up to the range cap. Sorted.
     */
    @Builder.Default
    List<String> references = List.of();

    /**
     * Formula cells that read this cell. Sorted.
     */
    @Builder.Default
    List<String> referencedBy = List.of();

    public boolean hasFormula() {
        return formula != null;
    }

    public CellPosition getPosition() {
        return new CellPosition(row, column);
    }
}
