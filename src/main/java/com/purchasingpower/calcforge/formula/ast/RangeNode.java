package com.purchasingpower.calcforge.formula.ast;

/**
 * @param range normalized range, e.g. {@code Sheet1!A1:B10}; unqualified when no sheet could be resolved
 */
public record RangeNode(String range) implements FormulaNode {

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitRange(this, argument);
    }
}
