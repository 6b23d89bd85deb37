package com.purchasingpower.calcforge.formula.ast;

public record StringNode(String value) implements FormulaNode {

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitString(this, argument);
    }
}
