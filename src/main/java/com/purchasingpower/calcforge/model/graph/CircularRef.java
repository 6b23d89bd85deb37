package com.purchasingpower.calcforge.model.graph;

import lombok.Value;

import java.util.List;

/**
 * Cells that could not be placed in execution order.
 */
@Value
public class CircularRef {

    List<String> cells;

    String refType;

    public boolean involves(String address) {
        return cells.contains(address);
    }
}
