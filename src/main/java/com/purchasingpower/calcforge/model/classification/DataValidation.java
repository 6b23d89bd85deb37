package com.purchasingpower.calcforge.model.classification;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Data-validation rule with its option list resolved to literals.
 */
@Value
@Builder
public class DataValidation {

    String sheet;

    /**
     * Raw validation type as reported by the reader (list, whole, decimal, ...).
     */
    String type;

    /**
     * Field type the rule implies, null when the rule type has no mapping.
     */
    InputType inputType;

    String operator;

    String formula1;

    String formula2;

    boolean allowBlank;

    /**
     * Literal choices of a list rule; empty for other rule types.
     */
    @Builder.Default
    List<String> options = List.of();

    /**
     * Every cell the rule applies to.
     */
    @Builder.Default
    List<String> appliesTo = List.of();

    String errorMessage;

    String prompt;

    public boolean isEnumeration() {
        return inputType == InputType.ENUM && !options.isEmpty();
    }
}
