package com.purchasingpower.calcforge.formula;

import java.util.List;

/**
 * Tokens of one formula plus the characters the lexer had to skip.
 */
public record TokenizationResult(List<Token> tokens, List<FormulaDiagnostic> diagnostics) {

    public TokenizationResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
