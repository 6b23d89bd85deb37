package com.purchasingpower.calcforge.model.workbook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawConditionalFormat {

    private String sheet;

    private String range;

    /**
     * Rule type, e.g. cellIs or expression.
     */
    private String type;

    private String formula;

    /**
     * ARGB fill or font color the rule applies.
     */
    private String color;

    /**
     * Severity if the reader already resolved one (error, warning, info).
     */
    private String severity;
}
