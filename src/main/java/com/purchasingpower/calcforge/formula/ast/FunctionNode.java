package com.purchasingpower.calcforge.formula.ast;

import java.util.List;

/**
 * @param name upper-case function name without {@code _xlfn.} prefixes
 */
public record FunctionNode(String name, List<FormulaNode> args) implements FormulaNode {

    public FunctionNode {
        args = List.copyOf(args);
    }

    public FormulaNode arg(int index) {
        return args.get(index);
    }

    public int arity() {
        return args.size();
    }

    @Override
    public <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument) {
        return visitor.visitFunction(this, argument);
    }
}
