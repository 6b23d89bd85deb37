package com.purchasingpower.calcforge.model.classification;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CellFormatting {

    String numberFormat;

    boolean bold;

    boolean italic;

    String fontColor;

    String fillColor;
}
