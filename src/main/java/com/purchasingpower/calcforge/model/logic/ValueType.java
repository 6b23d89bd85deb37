package com.purchasingpower.calcforge.model.logic;

/**
 * Type of a value flowing through a formula, as far as static inference can tell.
 */
public enum ValueType {
    NUMBER("number"),
    TEXT("string"),
    BOOLEAN("boolean"),
    DATE("date"),
    UNKNOWN("unknown");

    private final String value;

    ValueType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Common type of two branches: equal types stay, an unknown side defers to the
     * other, anything else is unknown.
     */
    public ValueType unify(ValueType other) {
        if (this == other) {
            return this;
        }
        if (this == UNKNOWN) {
            return other;
        }
        if (other == UNKNOWN) {
            return this;
        }
        return UNKNOWN;
    }
}
