package com.purchasingpower.calcforge.formula;

public enum TokenType {
    NUMBER,
    STRING,
    ERROR_LITERAL,
    RANGE,
    OPERATOR,
    SEPARATOR,
    LPAREN,
    RPAREN,
    REFERENCE,
    NAME
}
