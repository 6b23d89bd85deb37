package com.purchasingpower.calcforge.formula.ast;

public record UnaryNode(UnaryOp operator, FormulaNode operand) implements FormulaNode {

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitUnary(this, argument);
    }
}
