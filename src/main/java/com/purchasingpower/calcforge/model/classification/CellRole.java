package com.purchasingpower.calcforge.model.classification;

/**
 * Role of a cell in the workbook's calculation.
 */
public enum CellRole {
    INPUT("input"),
    FORMULA_INTERMEDIATE("intermediate"),
    FORMULA_OUTPUT("output"),
    STATIC("static"),
    LABEL("label"),
    STRUCTURAL("structural");

    private final String value;

    CellRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isFormula() {
        return this == FORMULA_INTERMEDIATE || this == FORMULA_OUTPUT;
    }

    /**
     * Inputs, intermediates and outputs: the cells a label can describe.
     */
    public boolean isCalculation() {
        return this == INPUT || isFormula();
    }

    public boolean isText() {
        return this == LABEL || this == STRUCTURAL;
    }
}
