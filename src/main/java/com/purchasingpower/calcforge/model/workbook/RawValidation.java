package com.purchasingpower.calcforge.model.workbook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Data-validation rule as exported by the workbook reader.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawValidation {

    private String sheet;

    /**
     * Space-separated target ranges, e.g. {@code B2:B5 D2}.
     */
    private String ranges;

    /**
     * list, whole, decimal, date, time, textLength or custom.
     */
    private String type;

    private String operator;

    private String formula1;

    private String formula2;

    @Builder.Default
    private boolean allowBlank = true;

    /**
     * Option list already resolved by the reader, if any.
     */
    @Builder.Default
    private List<String> options = new ArrayList<>();

    private String errorMessage;

    private String prompt;
}
