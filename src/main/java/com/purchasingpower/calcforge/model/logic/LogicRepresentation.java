package com.purchasingpower.calcforge.model.logic;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LogicRepresentation {

    String pseudocode;

    /**
     * Body of the generated calculation function.
     */
    String typescript;

    /**
     * zod schema source for the rule's inputs.
     */
    String validationSchema;
}
