package com.purchasingpower.calcforge.util;

/**
 * One-based grid position of a cell inside its sheet.
 */
public record CellPosition(int row, int column) {

    public CellPosition left() {
        return new CellPosition(row, column - 1);
    }

    public CellPosition right() {
        return new CellPosition(row, column + 1);
    }

    public CellPosition above() {
        return new CellPosition(row - 1, column);
    }

    public CellPosition below() {
        return new CellPosition(row + 1, column);
    }
}
