package com.purchasingpower.calcforge.model.classification;

import lombok.Value;

/**
 * Rows between one structural heading and the next.
 */
@Value
public class SheetSection {

    String title;

    String headingAddress;

    int startRow;

    int endRow;

    public boolean contains(int row) {
        return row >= startRow && row <= endRow;
    }
}
