package com.purchasingpower.calcforge.formula.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Infix operators with their binding strength. All are left-associative.
 */
public enum BinaryOp {
    POWER("^", 4, Kind.ARITHMETIC),
    MULTIPLY("*", 3, Kind.ARITHMETIC),
    DIVIDE("/", 3, Kind.ARITHMETIC),
    ADD("+", 2, Kind.ARITHMETIC),
    SUBTRACT("-", 2, Kind.ARITHMETIC),
    CONCAT("&", 2, Kind.TEXT),
    EQUAL("=", 1, Kind.COMPARISON),
    NOT_EQUAL("<>", 1, Kind.COMPARISON),
    LESS("<", 1, Kind.COMPARISON),
    LESS_OR_EQUAL("<=", 1, Kind.COMPARISON),
    GREATER(">", 1, Kind.COMPARISON),
    GREATER_OR_EQUAL(">=", 1, Kind.COMPARISON);

    public enum Kind {
        ARITHMETIC,
        TEXT,
        COMPARISON
    }

    private final String symbol;
    private final int precedence;
    private final Kind kind;

    BinaryOp(String symbol, int precedence, Kind kind) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.kind = kind;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isComparison() {
        return kind == Kind.COMPARISON;
    }

    public static Optional<BinaryOp> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
