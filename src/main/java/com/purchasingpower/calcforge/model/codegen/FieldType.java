package com.purchasingpower.calcforge.model.codegen;

import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.calcforge.model.classification.InputType;
import com.purchasingpower.calcforge.model.logic.ValueType;

/**
 * Field type of a generated form input or result, with its zod and Prisma renderings.
 */
public enum FieldType {
    NUMBER("number", "Float"),
    CURRENCY("currency", "Float"),
    PERCENTAGE("percentage", "Float"),
    TEXT("text", "String"),
    BOOLEAN("boolean", "Boolean"),
    DATE("date", "DateTime"),
    ENUM("enum", "String"),
    UNKNOWN("unknown", "String");

    private final String value;
    private final String prismaType;

    FieldType(String value, String prismaType) {
        this.value = value;
        this.prismaType = prismaType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getPrismaType() {
        return prismaType;
    }

    public boolean isNumeric() {
        return this == NUMBER || this == CURRENCY || this == PERCENTAGE;
    }

    /**
     * Inferred type first; the classifier's cell type refines numbers (currency,
     * percentage) and fills in when inference found nothing.
     */
    public static FieldType of(ValueType inferred, InputType cellType) {
        if (inferred == null || inferred == ValueType.UNKNOWN) {
            return cellType == null ? UNKNOWN : of(cellType);
        }
        return switch (inferred) {
            case NUMBER -> cellType != null && cellType.isNumeric() ? of(cellType) : NUMBER;
            case TEXT -> TEXT;
            case BOOLEAN -> BOOLEAN;
            case DATE -> DATE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public static FieldType of(InputType cellType) {
        return switch (cellType) {
            case NUMBER -> NUMBER;
            case CURRENCY -> CURRENCY;
            case PERCENTAGE -> PERCENTAGE;
            case TEXT -> TEXT;
            case BOOLEAN -> BOOLEAN;
            case DATE -> DATE;
            case ENUM -> ENUM;
        };
    }
}
