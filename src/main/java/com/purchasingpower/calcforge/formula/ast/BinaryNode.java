package com.purchasingpower.calcforge.formula.ast;

public record BinaryNode(BinaryOp operator, FormulaNode left, FormulaNode right) implements FormulaNode {

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitBinary(this, argument);
    }
}
