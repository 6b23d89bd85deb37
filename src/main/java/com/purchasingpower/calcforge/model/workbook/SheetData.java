package com.purchasingpower.calcforge.model.workbook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SheetData {

    private String name;

    @Builder.Default
    private List<RawCell> cells = new ArrayList<>();

    /**
     * Merged regions as sheet-local ranges, e.g. {@code A3:D3}.
     */
    @Builder.Default
    private List<String> mergedRanges = new ArrayList<>();
}
