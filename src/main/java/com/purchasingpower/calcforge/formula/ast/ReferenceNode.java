package com.purchasingpower.calcforge.formula.ast;

public record ReferenceNode(String address) implements FormulaNode {

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitReference(this, argument);
    }
}
