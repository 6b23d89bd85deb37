package com.purchasingpower.calcforge.formula.ast;

/**
 * @param <R> result of visiting a node
 * @param <P> argument threaded through the traversal
 */
public interface FormulaNodeVisitor<R, P> {

    R visitNumber(NumberNode node, P argument);

    R visitString(StringNode node, P argument);

    R visitReference(ReferenceNode node, P argument);

    R visitRange(RangeNode node, P argument);

    R visitUnary(UnaryNode node, P argument);

    R visitBinary(BinaryNode node, P argument);

    R visitFunction(FunctionNode node, P argument);

    R visitError(ErrorNode node, P argument);
}
