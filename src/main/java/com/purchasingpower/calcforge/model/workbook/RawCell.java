package com.purchasingpower.calcforge.model.workbook;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One non-empty cell as exported by the workbook reader.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawCell {

    /**
     * Sheet-local coordinate, e.g. {@code B12}.
     */
    private String coordinate;

    /**
     * Literal value (number, text, boolean, ISO date text). Null for formula cells
     * exported without a cached value.
     */
    private Object value;

    /**
     * Formula text including the leading {@code =}, or null for literals.
     */
    private String formula;

    private CellDataType dataType;

    private String numberFormat;

    private boolean bold;

    private boolean italic;

    private String fontColor;

    private String fillColor;

    @JsonIgnore
    public boolean hasFormula() {
        return formula != null && !formula.isBlank();
    }

    @JsonIgnore
    public boolean isEmpty() {
        if (hasFormula()) {
            return false;
        }
        return value == null || (value instanceof String text && text.isBlank());
    }
}
