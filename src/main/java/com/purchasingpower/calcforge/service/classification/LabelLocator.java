package com.purchasingpower.calcforge.service.classification;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.classification.CellRole;
import com.purchasingpower.calcforge.model.classification.ClassifiedCell;
import com.purchasingpower.calcforge.model.classification.SheetClassification;
import com.purchasingpower.calcforge.util.CellAddresses;
import com.purchasingpower.calcforge.util.CellPosition;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Finds the human text describing a cell: the nearest label or heading to its left,
 * else above it, and the section heading it sits under.
 */
public class LabelLocator {

    private final Map<String, Map<CellPosition, String>> labels = new HashMap<>();
    private final Map<String, TreeMap<Integer, String>> headingRows = new HashMap<>();

    public LabelLocator(CellClassificationResult classification) {
        for (SheetClassification sheet : classification.getSheets()) {
            Map<CellPosition, String> sheetLabels = new HashMap<>();
            TreeMap<Integer, String> sheetHeadings = new TreeMap<>();
            for (ClassifiedCell cell : sheet.getCells()) {
                if (!cell.getRole().isText() || cell.getLabel() == null || cell.getLabel().isBlank()) {
                    continue;
                }
                sheetLabels.put(cell.getPosition(), cell.getLabel());
                if (cell.getRole() == CellRole.STRUCTURAL) {
                    sheetHeadings.putIfAbsent(cell.getRow(), cell.getLabel());
                }
            }
            labels.put(sheet.getName(), sheetLabels);
            headingRows.put(sheet.getName(), sheetHeadings);
        }
    }

    /**
     * Walks left along the row, then up the column, and returns the first label found.
     */
    public Optional<String> labelFor(String address) {
        String sheet = CellAddresses.sheetOf(address);
        Optional<CellPosition> position = CellAddresses.position(address);
        Map<CellPosition, String> sheetLabels = labels.get(sheet);
        if (position.isEmpty() || sheetLabels == null) {
            return Optional.empty();
        }
        CellPosition start = position.get();
        for (int column = start.column() - 1; column >= 1; column--) {
            String label = sheetLabels.get(new CellPosition(start.row(), column));
            if (label != null) {
                return Optional.of(label);
            }
        }
        for (int row = start.row() - 1; row >= 1; row--) {
            String label = sheetLabels.get(new CellPosition(row, start.column()));
            if (label != null) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    /**
     * Heading of the nearest structural row at or above the cell, or "General".
     */
    public String sectionFor(String address) {
        TreeMap<Integer, String> sheetHeadings = headingRows.get(CellAddresses.sheetOf(address));
        Optional<CellPosition> position = CellAddresses.position(address);
        if (sheetHeadings == null || position.isEmpty()) {
            return "General";
        }
        Map.Entry<Integer, String> heading = sheetHeadings.floorEntry(position.get().row());
        return heading == null ? "General" : heading.getValue();
    }
}
