package com.purchasingpower.calcforge.formula;

/**
 * Non-fatal problem found while reading a formula.
 */
public record FormulaDiagnostic(Kind kind, String message, int position) {

    public enum Kind {
        UNKNOWN_CHARACTER,
        MISSING_OPERAND,
        UNEXPECTED_OPERAND,
        UNBALANCED_PARENTHESIS,
        UNRESOLVED_NAME
    }

    @Override
    public String toString() {
        return kind + " at " + position + ": " + message;
    }
}
