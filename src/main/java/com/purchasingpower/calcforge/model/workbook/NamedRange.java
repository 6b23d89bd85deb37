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
public class NamedRange {

    private String name;

    /**
     * Destination, e.g. {@code Rates!$B$2:$B$9}.
     */
    private String reference;
}
