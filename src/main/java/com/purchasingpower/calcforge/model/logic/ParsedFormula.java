package com.purchasingpower.calcforge.model.logic;

import com.purchasingpower.calcforge.formula.FormulaDiagnostic;
import com.purchasingpower.calcforge.formula.ast.FormulaNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A formula read into an AST. Malformed parts appear as error nodes and diagnostics;
 * parsing itself never fails.
 */
@Value
@Builder
public class ParsedFormula {

    /**
     * Address of the cell holding the formula.
     */
    String target;

    String raw;

    FormulaNode ast;

    /**
     * Distinct function names in order of first appearance.
     */
    @Builder.Default
    List<String> functions = List.of();

    /**
     * Referenced addresses, ranges expanded up to the cap, sorted.
     */
    @Builder.Default
    List<String> references = List.of();

    /**
     * Number and text literals in order of appearance.
     */
    @Builder.Default
    List<Object> constants = List.of();

    @Builder.Default
    List<FormulaDiagnostic> diagnostics = List.of();

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
