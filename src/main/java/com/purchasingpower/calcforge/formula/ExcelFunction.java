package com.purchasingpower.calcforge.formula;

import com.purchasingpower.calcforge.model.logic.ValueType;

import java.util.Optional;
import java.util.Set;

/**
 * Functions the compiler can evaluate and translate. Anything not listed here is
 * reported as unsupported instead of being guessed at.
 *
 * <p>Each entry carries the type it returns, the type its arguments are expected to
 * have, and the helper implementing it in the generated TypeScript runtime.
 */
public enum ExcelFunction {
    SUM(ValueType.NUMBER, ValueType.NUMBER, "sum"),
    AVERAGE(ValueType.NUMBER, ValueType.NUMBER, "average"),
    MIN(ValueType.NUMBER, ValueType.NUMBER, "min"),
    MAX(ValueType.NUMBER, ValueType.NUMBER, "max"),
    COUNT(ValueType.NUMBER, ValueType.UNKNOWN, "count"),
    ABS(ValueType.NUMBER, ValueType.NUMBER, "abs"),
    ROUND(ValueType.NUMBER, ValueType.NUMBER, "round"),
    ROUNDUP(ValueType.NUMBER, ValueType.NUMBER, "roundUp"),
    ROUNDDOWN(ValueType.NUMBER, ValueType.NUMBER, "roundDown"),
    IF(ValueType.UNKNOWN, ValueType.UNKNOWN, null),
    IFS(ValueType.UNKNOWN, ValueType.UNKNOWN, "ifs"),
    IFERROR(ValueType.UNKNOWN, ValueType.UNKNOWN, "ifError"),
    AND(ValueType.BOOLEAN, ValueType.BOOLEAN, "and"),
    OR(ValueType.BOOLEAN, ValueType.BOOLEAN, "or"),
    NOT(ValueType.BOOLEAN, ValueType.BOOLEAN, "not"),
    TRUE(ValueType.BOOLEAN, ValueType.UNKNOWN, null),
    FALSE(ValueType.BOOLEAN, ValueType.UNKNOWN, null),
    CONCAT(ValueType.TEXT, ValueType.TEXT, "concat"),
    CONCATENATE(ValueType.TEXT, ValueType.TEXT, "concat"),
    LEFT(ValueType.TEXT, ValueType.UNKNOWN, "left"),
    RIGHT(ValueType.TEXT, ValueType.UNKNOWN, "right"),
    MID(ValueType.TEXT, ValueType.UNKNOWN, "mid"),
    LEN(ValueType.NUMBER, ValueType.TEXT, "len"),
    UPPER(ValueType.TEXT, ValueType.TEXT, "upper"),
    LOWER(ValueType.TEXT, ValueType.TEXT, "lower"),
    TRIM(ValueType.TEXT, ValueType.TEXT, "trim"),
    SUMIF(ValueType.NUMBER, ValueType.UNKNOWN, "sumIf"),
    SUMIFS(ValueType.NUMBER, ValueType.UNKNOWN, "sumIfs"),
    COUNTIF(ValueType.NUMBER, ValueType.UNKNOWN, "countIf"),
    COUNTIFS(ValueType.NUMBER, ValueType.UNKNOWN, "countIfs"),
    AVERAGEIFS(ValueType.NUMBER, ValueType.UNKNOWN, "averageIfs"),
    VLOOKUP(ValueType.UNKNOWN, ValueType.UNKNOWN, "vlookup"),
    XLOOKUP(ValueType.UNKNOWN, ValueType.UNKNOWN, "xlookup"),
    INDEX(ValueType.UNKNOWN, ValueType.UNKNOWN, "index"),
    MATCH(ValueType.NUMBER, ValueType.UNKNOWN, "match"),
    DATE(ValueType.DATE, ValueType.NUMBER, "date"),
    TODAY(ValueType.DATE, ValueType.UNKNOWN, "today"),
    NOW(ValueType.DATE, ValueType.UNKNOWN, "now"),
    YEAR(ValueType.NUMBER, ValueType.DATE, "year"),
    MONTH(ValueType.NUMBER, ValueType.DATE, "month"),
    DAY(ValueType.NUMBER, ValueType.DATE, "day");

    /**
     * Functions that build references at runtime and therefore cannot be compiled to
     * static code.
     */
    public static final Set<String> DYNAMIC_REFERENCE_FUNCTIONS = Set.of("INDIRECT", "OFFSET", "ADDRESS");

    private final ValueType returnType;
    private final ValueType argumentType;
    private final String runtimeHelper;

    ExcelFunction(ValueType returnType, ValueType argumentType, String runtimeHelper) {
        this.returnType = returnType;
        this.argumentType = argumentType;
        this.runtimeHelper = runtimeHelper;
    }

    public ValueType getReturnType() {
        return returnType;
    }

    public ValueType getArgumentType() {
        return argumentType;
    }

    /**
     * Name of the runtime helper, null for functions translated inline (IF, TRUE, FALSE).
     */
    public String getRuntimeHelper() {
        return runtimeHelper;
    }

    public static Optional<ExcelFunction> lookup(String name) {
        for (ExcelFunction function : values()) {
            if (function.name().equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    public static boolean isSupported(String name) {
        return lookup(name).isPresent();
    }

    public static boolean isDynamicReference(String name) {
        return DYNAMIC_REFERENCE_FUNCTIONS.contains(name);
    }
}
