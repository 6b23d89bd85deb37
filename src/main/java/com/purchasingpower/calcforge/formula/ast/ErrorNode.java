package com.purchasingpower.calcforge.formula.ast;

public record ErrorNode(String reason) implements FormulaNode {

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitError(this, argument);
    }
}
