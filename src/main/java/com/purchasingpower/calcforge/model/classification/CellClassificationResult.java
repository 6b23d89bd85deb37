package com.purchasingpower.calcforge.model.classification;

import com.purchasingpower.calcforge.model.workbook.PivotTableDefinition;
import com.purchasingpower.calcforge.model.workbook.VbaMacro;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Output of cell classification: every non-empty cell with its role, plus the
 * workbook-level facts later stages need.
 */
@Value
@Builder
public class CellClassificationResult {

    String workbookName;

    @Builder.Default
    List<SheetClassification> sheets = List.of();

    /**
     * Upper-cased name to normalized destination ({@code Sheet!A1} or {@code Sheet!A1:B2}).
     */
    @Builder.Default
    Map<String, String> namedRanges = Map.of();

    @Builder.Default
    List<VbaMacro> macros = List.of();

    @Builder.Default
    List<DataValidation> validations = List.of();

    @Builder.Default
    List<ConditionalFormat> conditionalFormats = List.of();

    @Builder.Default
    List<PivotTableDefinition> pivotTables = List.of();

    public List<ClassifiedCell> allCells() {
        return sheets.stream()
                .flatMap(sheet -> sheet.getCells().stream())
                .collect(Collectors.toList());
    }

    public Map<String, ClassifiedCell> cellsByAddress() {
        Map<String, ClassifiedCell> index = new LinkedHashMap<>();
        for (ClassifiedCell cell : allCells()) {
            index.put(cell.getAddress(), cell);
        }
        return index;
    }

    public Optional<ClassifiedCell> findCell(String address) {
        return allCells().stream().filter(cell -> cell.getAddress().equals(address)).findFirst();
    }

    public Optional<SheetClassification> findSheet(String name) {
        return sheets.stream().filter(sheet -> sheet.getName().equals(name)).findFirst();
    }
}
