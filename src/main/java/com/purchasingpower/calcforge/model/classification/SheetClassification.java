package com.purchasingpower.calcforge.model.classification;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SheetClassification {

    String name;

    /**
     * Cells in row-major order.
     */
    @Builder.Default
    List<ClassifiedCell> cells = List.of();

    @Builder.Default
    List<SheetSection> sections = List.of();

    @Builder.Default
    List<CellGroup> inputGroups = List.of();

    @Builder.Default
    List<CellGroup> outputGroups = List.of();

    int maxRow;

    int maxColumn;
}
