package com.purchasingpower.calcforge.formula;

import com.purchasingpower.calcforge.formula.ast.BinaryNode;
import com.purchasingpower.calcforge.formula.ast.ErrorNode;
import com.purchasingpower.calcforge.formula.ast.FormulaNode;
import com.purchasingpower.calcforge.formula.ast.FormulaNodeVisitor;
import com.purchasingpower.calcforge.formula.ast.FunctionNode;
import com.purchasingpower.calcforge.formula.ast.NumberNode;
import com.purchasingpower.calcforge.formula.ast.RangeNode;
import com.purchasingpower.calcforge.formula.ast.ReferenceNode;
import com.purchasingpower.calcforge.formula.ast.StringNode;
import com.purchasingpower.calcforge.formula.ast.UnaryNode;
import com.purchasingpower.calcforge.formula.ast.UnaryOp;
import com.purchasingpower.calcforge.model.logic.ParsedFormula;
import com.purchasingpower.calcforge.model.logic.ValueType;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Infers cell types from how formulas use them.
 *
 * <p>Each formula is walked once, top-down, carrying the type its context expects.
 * Every reference remembers the expectations it met across the whole cluster; a
 * reference that met exactly one known expectation gets that type.
 */
@RequiredArgsConstructor
public class TypeInferencer {

    private final RangeExpander rangeExpander;

    public TypeInference infer(List<ParsedFormula> formulas) {
        Map<String, Set<ValueType>> expectations = new TreeMap<>();
        Map<String, ValueType> outputs = new LinkedHashMap<>();
        Walk walk = new Walk(expectations);
        for (ParsedFormula formula : formulas) {
            outputs.put(formula.getTarget(), formula.getAst().accept(walk, ValueType.UNKNOWN));
        }

        Map<String, ValueType> references = new TreeMap<>();
        expectations.forEach((address, seen) ->
                references.put(address, seen.size() == 1 ? seen.iterator().next() : ValueType.UNKNOWN));
        return new TypeInference(references, outputs);
    }

    private final class Walk implements FormulaNodeVisitor<ValueType, ValueType> {

        private final Map<String, Set<ValueType>> expectations;

        Walk(Map<String, Set<ValueType>> expectations) {
            this.expectations = expectations;
        }

        @Override
        public ValueType visitNumber(NumberNode node, ValueType expected) {
            return ValueType.NUMBER;
        }

        @Override
        public ValueType visitString(StringNode node, ValueType expected) {
            return ValueType.TEXT;
        }

        @Override
        public ValueType visitReference(ReferenceNode node, ValueType expected) {
            expect(node.address(), expected);
            return ValueType.UNKNOWN;
        }

        @Override
        public ValueType visitRange(RangeNode node, ValueType expected) {
            rangeExpander.expand(node.range()).forEach(address -> expect(address, expected));
            return ValueType.UNKNOWN;
        }

        @Override
        public ValueType visitUnary(UnaryNode node, ValueType expected) {
            if (node.operator() == UnaryOp.PLUS) {
                return node.operand().accept(this, expected);
            }
            node.operand().accept(this, ValueType.NUMBER);
            return ValueType.NUMBER;
        }

        @Override
        public ValueType visitBinary(BinaryNode node, ValueType expected) {
            switch (node.operator().getKind()) {
                case ARITHMETIC -> {
                    node.left().accept(this, ValueType.NUMBER);
                    node.right().accept(this, ValueType.NUMBER);
                    return ValueType.NUMBER;
                }
                case TEXT -> {
                    node.left().accept(this, ValueType.TEXT);
                    node.right().accept(this, ValueType.TEXT);
                    return ValueType.TEXT;
                }
                default -> {
                    node.left().accept(this, comparedWith(node.right()));
                    node.right().accept(this, comparedWith(node.left()));
                    return ValueType.BOOLEAN;
                }
            }
        }

        @Override
        public ValueType visitFunction(FunctionNode node, ValueType expected) {
            ExcelFunction function = ExcelFunction.lookup(node.name()).orElse(null);
            if (function == null) {
                node.args().forEach(arg -> arg.accept(this, ValueType.UNKNOWN));
                return ValueType.UNKNOWN;
            }
            switch (function) {
                case IF -> {
                    if (node.arity() > 0) {
                        node.arg(0).accept(this, ValueType.BOOLEAN);
                    }
                    ValueType whenTrue = node.arity() > 1 ? node.arg(1).accept(this, expected) : ValueType.BOOLEAN;
                    ValueType whenFalse = node.arity() > 2 ? node.arg(2).accept(this, expected) : ValueType.BOOLEAN;
                    return whenTrue.unify(whenFalse);
                }
                case IFS -> {
                    ValueType result = ValueType.UNKNOWN;
                    boolean first = true;
                    for (int i = 0; i < node.arity(); i++) {
                        if (i % 2 == 0) {
                            node.arg(i).accept(this, ValueType.BOOLEAN);
                        } else {
                            ValueType branch = node.arg(i).accept(this, expected);
                            result = first ? branch : result.unify(branch);
                            first = false;
                        }
                    }
                    return result;
                }
                case IFERROR -> {
                    ValueType result = ValueType.UNKNOWN;
                    for (int i = 0; i < node.arity(); i++) {
                        ValueType branch = node.arg(i).accept(this, expected);
                        result = i == 0 ? branch : result.unify(branch);
                    }
                    return result;
                }
                default -> {
                    for (int i = 0; i < node.arity(); i++) {
                        node.arg(i).accept(this, argumentType(function, i));
                    }
                    return function.getReturnType();
                }
            }
        }

        @Override
        public ValueType visitError(ErrorNode node, ValueType expected) {
            return ValueType.UNKNOWN;
        }

        private void expect(String address, ValueType expected) {
            Set<ValueType> seen = expectations.computeIfAbsent(address, key -> EnumSet.noneOf(ValueType.class));
            if (expected.isKnown()) {
                seen.add(expected);
            }
        }
    }

    /**
     * Positional arguments that are always numbers (column indexes, counts, modes).
     */
    private static ValueType argumentType(ExcelFunction function, int index) {
        return switch (function) {
            case VLOOKUP -> index == 2 ? ValueType.NUMBER : ValueType.UNKNOWN;
            case INDEX -> index > 0 ? ValueType.NUMBER : ValueType.UNKNOWN;
            case MATCH -> index == 2 ? ValueType.NUMBER : ValueType.UNKNOWN;
            case XLOOKUP -> index > 3 ? ValueType.NUMBER : ValueType.UNKNOWN;
            case LEFT, RIGHT -> index == 0 ? ValueType.TEXT : ValueType.NUMBER;
            case MID -> index == 0 ? ValueType.TEXT : ValueType.NUMBER;
            default -> function.getArgumentType();
        };
    }

    /**
     * A comparison operand is expected to match a literal on the other side, and is
     * otherwise expected to be numeric.
     */
    private static ValueType comparedWith(FormulaNode other) {
        if (other instanceof StringNode) {
            return ValueType.TEXT;
        }
        if (other instanceof FunctionNode function
                && (function.name().equals("TRUE") || function.name().equals("FALSE"))) {
            return ValueType.BOOLEAN;
        }
        return ValueType.NUMBER;
    }
}
