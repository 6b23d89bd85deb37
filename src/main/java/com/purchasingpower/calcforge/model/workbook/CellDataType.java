package com.purchasingpower.calcforge.model.workbook;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Data type flag reported by the workbook reader for a literal cell.
 */
public enum CellDataType {
    NUMBER,
    TEXT,
    BOOLEAN,
    DATE,
    ERROR,
    FORMULA;

    @JsonCreator
    public static CellDataType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "n", "number", "numeric" -> NUMBER;
            case "b", "bool", "boolean" -> BOOLEAN;
            case "d", "date", "datetime" -> DATE;
            case "e", "error" -> ERROR;
            case "f", "formula" -> FORMULA;
            default -> TEXT;
        };
    }
}
