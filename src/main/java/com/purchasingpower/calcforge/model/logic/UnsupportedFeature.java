package com.purchasingpower.calcforge.model.logic;

import lombok.Builder;
import lombok.Value;

/**
 * Something in a formula the compiler cannot turn into static code. Recorded, never thrown.
 */
@Value
@Builder
public class UnsupportedFeature {

    FeatureKind kind;

    String cellAddress;

    String formula;

    /**
     * Function name or construct that triggered the finding.
     */
    String detail;

    String explanation;

    String suggestedFix;
}
