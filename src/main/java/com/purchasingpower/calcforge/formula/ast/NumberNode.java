package com.purchasingpower.calcforge.formula.ast;

public record NumberNode(double value) implements FormulaNode {

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitNumber(this, argument);
    }
}
