package com.purchasingpower.calcforge.model.logic;

public enum FeatureKind {
    DYNAMIC_REFERENCE("dynamic_reference"),
    UNSUPPORTED_FUNCTION("unsupported_function"),
    CIRCULAR_REFERENCE("circular_reference"),
    MALFORMED_FORMULA("malformed_formula");

    private final String value;

    FeatureKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
