package com.purchasingpower.calcforge.model.classification;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConditionalFormat {

    String sheet;

    String range;

    /**
     * {@code type:formula} description of the rule.
     */
    String rule;

    String color;

    AlertSeverity severity;
}
