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
public class PivotTableDefinition {

    private String name;

    private String sheet;

    private String sourceRange;

    @Builder.Default
    private List<String> rowFields = new ArrayList<>();

    @Builder.Default
    private List<String> columnFields = new ArrayList<>();

    @Builder.Default
    private List<String> valueFields = new ArrayList<>();

    @Builder.Default
    private List<String> filterFields = new ArrayList<>();
}
