package com.purchasingpower.calcforge.formula;

/**
 * @param position zero-based offset in the formula text after the leading {@code =}
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }
}
