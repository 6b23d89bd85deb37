package com.purchasingpower.calcforge.model.classification;

public enum InputType {
    TEXT("text"),
    NUMBER("number"),
    CURRENCY("currency"),
    PERCENTAGE("percentage"),
    DATE("date"),
    BOOLEAN("boolean"),
    ENUM("enum");

    private final String value;

    InputType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isNumeric() {
        return this == NUMBER || this == CURRENCY || this == PERCENTAGE;
    }
}
