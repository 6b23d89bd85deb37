package com.purchasingpower.calcforge.model.codegen;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldKind {
    INPUT("input"),
    OUTPUT("output");

    private final String value;

    FieldKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
