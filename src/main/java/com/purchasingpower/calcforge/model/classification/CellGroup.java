package com.purchasingpower.calcforge.model.classification;

import lombok.Value;

import java.util.List;

@Value
public class CellGroup {

    String name;

    String sheet;

    String section;

    List<String> cells;
}
