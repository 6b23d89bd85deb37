package com.purchasingpower.calcforge.formula.ast;

/**
 * Node of a parsed formula. The set of node kinds is closed; consumers dispatch
 * through {@link FormulaNodeVisitor} so a new kind fails compilation everywhere it
 * is not handled.
 */
public sealed interface FormulaNode
        permits NumberNode, StringNode, ReferenceNode, RangeNode, UnaryNode, BinaryNode, FunctionNode, ErrorNode {

    <R, P> R accept(FormulaNodeVisitor<R, P> visitor, P argument);
}
