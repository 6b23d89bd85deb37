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
import com.purchasingpower.calcforge.util.CellAddresses;
import com.purchasingpower.calcforge.util.TypeScriptLiterals;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Translates formula trees into TypeScript expressions over the generated runtime
 * ({@code rt.*} helpers) and a {@code ref(address)} accessor.
 *
 * <p>Operators and functions map one to one onto runtime helpers with the same
 * semantics as {@link FormulaEvaluator}. Ranges become nested array literals up to the
 * shared expansion cap; larger or sheet-less ranges become {@code rt.unsupportedRange}
 * calls that throw when reached.
 */
@RequiredArgsConstructor
public class TypeScriptTranslator {

    static final String RUNTIME = "rt";
    static final String REF = "ref";

    private final RangeExpander rangeExpander;

    public TranslationResult translate(FormulaNode node) {
        List<String> problems = new ArrayList<>();
        try {
            String expression = node.accept(new Emitter(), problems);
            return TranslationResult.supported(expression, problems);
        } catch (UntranslatableException e) {
            return TranslationResult.unsupported(e.getMessage());
        }
    }

    private static final class UntranslatableException extends RuntimeException {

        UntranslatableException(String message) {
            super(message);
        }
    }

    private final class Emitter implements FormulaNodeVisitor<String, List<String>> {

        @Override
        public String visitNumber(NumberNode node, List<String> problems) {
            return TypeScriptLiterals.number(node.value());
        }

        @Override
        public String visitString(StringNode node, List<String> problems) {
            return TypeScriptLiterals.string(node.value());
        }

        @Override
        public String visitReference(ReferenceNode node, List<String> problems) {
            return REF + "(" + TypeScriptLiterals.string(node.address()) + ")";
        }

        @Override
        public String visitRange(RangeNode node, List<String> problems) {
            String range = node.range();
            if (CellAddresses.sheetOf(range) == null) {
                problems.add("Range " + range + " has no resolvable sheet");
                return unsupportedRange(range);
            }
            Optional<List<List<String>>> grid = rangeExpander.grid(range);
            if (grid.isEmpty()) {
                problems.add("Range " + range + " exceeds the " + rangeExpander.getCap() + "-cell expansion limit");
                return unsupportedRange(range);
            }
            return grid.get().stream()
                    .map(row -> row.stream()
                            .map(address -> REF + "(" + TypeScriptLiterals.string(address) + ")")
                            .collect(Collectors.joining(", ", "[", "]")))
                    .collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public String visitUnary(UnaryNode node, List<String> problems) {
            String operand = node.operand().accept(this, problems);
            return switch (node.operator()) {
                case NEGATE -> "(-" + num(operand) + ")";
                case PLUS -> operand;
                case PERCENT -> "(" + num(operand) + " / 100)";
            };
        }

        @Override
        public String visitBinary(BinaryNode node, List<String> problems) {
            String left = node.left().accept(this, problems);
            String right = node.right().accept(this, problems);
            return switch (node.operator()) {
                case ADD -> "(" + num(left) + " + " + num(right) + ")";
                case SUBTRACT -> "(" + num(left) + " - " + num(right) + ")";
                case MULTIPLY -> "(" + num(left) + " * " + num(right) + ")";
                case DIVIDE -> RUNTIME + ".divide(" + left + ", " + right + ")";
                case POWER -> "(" + num(left) + " ** " + num(right) + ")";
                case CONCAT -> "(" + RUNTIME + ".text(" + left + ") + " + RUNTIME + ".text(" + right + "))";
                case EQUAL -> RUNTIME + ".eq(" + left + ", " + right + ")";
                case NOT_EQUAL -> "!" + RUNTIME + ".eq(" + left + ", " + right + ")";
                case LESS -> "(" + RUNTIME + ".compare(" + left + ", " + right + ") < 0)";
                case LESS_OR_EQUAL -> "(" + RUNTIME + ".compare(" + left + ", " + right + ") <= 0)";
                case GREATER -> "(" + RUNTIME + ".compare(" + left + ", " + right + ") > 0)";
                case GREATER_OR_EQUAL -> "(" + RUNTIME + ".compare(" + left + ", " + right + ") >= 0)";
            };
        }

        @Override
        public String visitFunction(FunctionNode node, List<String> problems) {
            if (ExcelFunction.isDynamicReference(node.name())) {
                throw new UntranslatableException(node.name() + " builds references at runtime");
            }
            ExcelFunction function = ExcelFunction.lookup(node.name())
                    .orElseThrow(() -> new UntranslatableException("Unsupported function: " + node.name()));
            List<String> args = new ArrayList<>();
            for (FormulaNode arg : node.args()) {
                args.add(arg.accept(this, problems));
            }
            return switch (function) {
                case TRUE -> "true";
                case FALSE -> "false";
                case IF -> "(" + RUNTIME + ".truthy(" + argOr(args, 0, "false") + ") ? "
                        + argOr(args, 1, "true") + " : " + argOr(args, 2, "false") + ")";
                case IFERROR -> RUNTIME + ".ifError(() => " + argOr(args, 0, "0") + ", () => " + argOr(args, 1, "0") + ")";
                default -> RUNTIME + "." + function.getRuntimeHelper() + "(" + String.join(", ", args) + ")";
            };
        }

        @Override
        public String visitError(ErrorNode node, List<String> problems) {
            throw new UntranslatableException("Malformed formula: " + node.reason());
        }

        private String num(String expression) {
            return RUNTIME + ".num(" + expression + ")";
        }

        private String argOr(List<String> args, int index, String fallback) {
            return index < args.size() ? args.get(index) : fallback;
        }

        private String unsupportedRange(String range) {
            return RUNTIME + ".unsupportedRange(" + TypeScriptLiterals.string(range) + ")";
        }
    }
}
