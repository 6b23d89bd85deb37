package com.purchasingpower.calcforge.formula.ast;

public enum UnaryOp {
    NEGATE("-"),
    PLUS("+"),
    /**
     * Postfix {@code %}: divides the operand by 100.
     */
    PERCENT("%");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
