package com.purchasingpower.calcforge.model.workbook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the external workbook reader extracts from one workbook file.
 * This is the input contract of the compiler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkbookStructure {

    private String fileName;

    @Builder.Default
    private List<SheetData> sheets = new ArrayList<>();

    @Builder.Default
    private List<NamedRange> namedRanges = new ArrayList<>();

    @Builder.Default
    private List<RawValidation> dataValidations = new ArrayList<>();

    @Builder.Default
    private List<RawConditionalFormat> conditionalFormats = new ArrayList<>();

    @Builder.Default
    private List<PivotTableDefinition> pivotTables = new ArrayList<>();

    @Builder.Default
    private List<VbaMacro> macros = new ArrayList<>();
}
