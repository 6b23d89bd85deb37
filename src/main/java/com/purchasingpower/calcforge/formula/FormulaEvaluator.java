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
import com.purchasingpower.calcforge.model.logic.ParsedFormula;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tree-walking evaluator used to pin the expected results of generated code.
 *
 * <p>References read the running context of values computed earlier in the same
 * cluster first, then the supplied inputs, and default to 0. Division by zero and
 * malformed subexpressions yield 0. Functions outside {@link ExcelFunction} fail the
 * evaluation instead of producing a guess.
 */
@Slf4j
@RequiredArgsConstructor
public class FormulaEvaluator {

    private final RangeExpander rangeExpander;
    private final Clock clock;

    public EvaluationResult evaluate(FormulaNode node, Map<String, Object> inputs, Map<String, Object> context) {
        try {
            Object value = node.accept(new Evaluation(inputs, context), null);
            return EvaluationResult.success(result(value));
        } catch (EvaluationAbort abort) {
            return EvaluationResult.failure(abort.getMessage());
        } catch (DateTimeException | ArithmeticException e) {
            log.debug("Evaluation failed with {}", e.toString());
            return EvaluationResult.failure(e.getMessage());
        }
    }

    /**
     * Evaluates formulas in the given order, each seeing the results of those before it.
     *
     * @return on success, every formula's target address mapped to its value
     */
    public ClusterEvaluationResult evaluateInOrder(List<ParsedFormula> formulas, Map<String, Object> inputs) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (ParsedFormula formula : formulas) {
            EvaluationResult result = evaluate(formula.getAst(), inputs, context);
            if (!result.isSuccess()) {
                log.debug("Evaluation of {} failed: {}", formula.getTarget(), result.getError());
                return ClusterEvaluationResult.failure(formula.getTarget() + ": " + result.getError());
            }
            context.put(formula.getTarget(), result.getValue());
        }
        return ClusterEvaluationResult.success(context);
    }

    private static Object result(Object value) {
        if (value instanceof RangeValue range) {
            List<Object> cells = range.flatten();
            return cells.isEmpty() ? 0.0 : result(cells.get(0));
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return 0.0;
            }
            return d == 0 ? 0.0 : d;
        }
        return value == null ? 0.0 : value;
    }

    private static final class EvaluationAbort extends RuntimeException {

        EvaluationAbort(String message) {
            super(message);
        }
    }

    private final class Evaluation implements FormulaNodeVisitor<Object, Void> {

        private final Map<String, Object> inputs;
        private final Map<String, Object> context;

        Evaluation(Map<String, Object> inputs, Map<String, Object> context) {
            this.inputs = inputs;
            this.context = context;
        }

        @Override
        public Object visitNumber(NumberNode node, Void unused) {
            return node.value();
        }

        @Override
        public Object visitString(StringNode node, Void unused) {
            return node.value();
        }

        @Override
        public Object visitReference(ReferenceNode node, Void unused) {
            return lookup(node.address());
        }

        @Override
        public Object visitRange(RangeNode node, Void unused) {
            return rangeExpander.grid(node.range())
                    .map(rows -> {
                        List<List<Object>> values = new ArrayList<>(rows.size());
                        for (List<String> row : rows) {
                            List<Object> cells = new ArrayList<>(row.size());
                            row.forEach(address -> cells.add(lookup(address)));
                            values.add(cells);
                        }
                        return new RangeValue(values);
                    })
                    .orElseGet(() -> opaqueRange(node.range()));
        }

        @Override
        public Object visitUnary(UnaryNode node, Void unused) {
            Object operand = node.operand().accept(this, null);
            return switch (node.operator()) {
                case NEGATE -> -ValueCoercion.toNumber(operand);
                case PLUS -> operand;
                case PERCENT -> ValueCoercion.toNumber(operand) / 100;
            };
        }

        @Override
        public Object visitBinary(BinaryNode node, Void unused) {
            Object left = node.left().accept(this, null);
            Object right = node.right().accept(this, null);
            return switch (node.operator()) {
                case ADD -> ValueCoercion.toNumber(left) + ValueCoercion.toNumber(right);
                case SUBTRACT -> ValueCoercion.toNumber(left) - ValueCoercion.toNumber(right);
                case MULTIPLY -> ValueCoercion.toNumber(left) * ValueCoercion.toNumber(right);
                case DIVIDE -> {
                    double divisor = ValueCoercion.toNumber(right);
                    yield divisor == 0 ? 0.0 : ValueCoercion.toNumber(left) / divisor;
                }
                case POWER -> Math.pow(ValueCoercion.toNumber(left), ValueCoercion.toNumber(right));
                case CONCAT -> ValueCoercion.toText(left) + ValueCoercion.toText(right);
                case EQUAL -> compare(left, right) == 0;
                case NOT_EQUAL -> compare(left, right) != 0;
                case LESS -> compare(left, right) < 0;
                case LESS_OR_EQUAL -> compare(left, right) <= 0;
                case GREATER -> compare(left, right) > 0;
                case GREATER_OR_EQUAL -> compare(left, right) >= 0;
            };
        }

        @Override
        public Object visitError(ErrorNode node, Void unused) {
            return 0.0;
        }

        @Override
        public Object visitFunction(FunctionNode node, Void unused) {
            ExcelFunction function = ExcelFunction.lookup(node.name())
                    .orElseThrow(() -> new EvaluationAbort("Unsupported function: " + node.name()));
            return switch (function) {
                case SUM -> numbers(node).stream().mapToDouble(Double::doubleValue).sum();
                case AVERAGE -> numbers(node).stream().mapToDouble(Double::doubleValue).average().orElse(0);
                case MIN -> numbers(node).stream().mapToDouble(Double::doubleValue).min().orElse(0);
                case MAX -> numbers(node).stream().mapToDouble(Double::doubleValue).max().orElse(0);
                case COUNT -> (double) values(node).stream().filter(Number.class::isInstance).count();
                case ABS -> Math.abs(number(node, 0));
                case ROUND -> round(node, RoundingMode.HALF_UP);
                case ROUNDUP -> round(node, RoundingMode.UP);
                case ROUNDDOWN -> round(node, RoundingMode.DOWN);
                case IF -> conditional(node);
                case IFS -> firstTrue(node);
                case IFERROR -> fallbackOnError(node);
                case AND -> values(node).stream().allMatch(ValueCoercion::toBoolean);
                case OR -> values(node).stream().anyMatch(ValueCoercion::toBoolean);
                case NOT -> !ValueCoercion.toBoolean(arg(node, 0));
                case TRUE -> Boolean.TRUE;
                case FALSE -> Boolean.FALSE;
                case CONCAT, CONCATENATE -> concat(node);
                case LEFT -> left(text(node, 0), node.arity() > 1 ? (int) number(node, 1) : 1);
                case RIGHT -> right(text(node, 0), node.arity() > 1 ? (int) number(node, 1) : 1);
                case MID -> mid(text(node, 0), (int) number(node, 1), (int) number(node, 2));
                case LEN -> (double) text(node, 0).length();
                case UPPER -> text(node, 0).toUpperCase(Locale.ROOT);
                case LOWER -> text(node, 0).toLowerCase(Locale.ROOT);
                case TRIM -> text(node, 0).trim().replaceAll(" +", " ");
                case SUMIF -> sumIf(node);
                case SUMIFS -> sumIfs(node);
                case COUNTIF -> (double) matchingRows(node, 0).size();
                case COUNTIFS -> (double) matchingRows(node, 0).size();
                case AVERAGEIFS -> averageIfs(node);
                case VLOOKUP -> LookupFunctions.vlookup(arg(node, 0), range(node, 1), (int) number(node, 2),
                        node.arity() < 4 || ValueCoercion.toBoolean(arg(node, 3)));
                case XLOOKUP -> LookupFunctions.xlookup(arg(node, 0), range(node, 1), range(node, 2),
                        node.arity() > 3 ? arg(node, 3) : null,
                        node.arity() > 4 ? (int) number(node, 4) : 0,
                        node.arity() > 5 ? (int) number(node, 5) : 1);
                case INDEX -> LookupFunctions.index(range(node, 0), (int) number(node, 1),
                        node.arity() > 2 ? (int) number(node, 2) : null);
                case MATCH -> LookupFunctions.match(arg(node, 0), range(node, 1),
                        node.arity() > 2 ? (int) number(node, 2) : 1);
                case DATE -> (double) ExcelDates.serial((int) number(node, 0), (int) number(node, 1), (int) number(node, 2));
                case TODAY -> (double) ExcelDates.today(clock);
                case NOW -> ExcelDates.now(clock);
                case YEAR -> (double) ExcelDates.parts(ExcelDates.toSerial(arg(node, 0))).year();
                case MONTH -> (double) ExcelDates.parts(ExcelDates.toSerial(arg(node, 0))).month();
                case DAY -> (double) ExcelDates.parts(ExcelDates.toSerial(arg(node, 0))).day();
            };
        }

        private Object lookup(String address) {
            if (context.containsKey(address)) {
                return context.get(address);
            }
            Object input = inputs.get(address);
            return input == null ? 0.0 : ValueCoercion.normalize(input);
        }

        /**
         * Ranges above the cap have no cell addresses; they can only be supplied whole,
         * as a list keyed by the range itself.
         */
        private RangeValue opaqueRange(String range) {
            Object supplied = inputs.get(range);
            if (supplied instanceof List<?> values) {
                return RangeValue.column(values.stream().map(ValueCoercion::normalize).toList());
            }
            return supplied == null ? RangeValue.empty() : RangeValue.single(ValueCoercion.normalize(supplied));
        }

        private Object arg(FunctionNode node, int index) {
            if (index >= node.arity()) {
                throw new EvaluationAbort(node.name() + " expects at least " + (index + 1) + " arguments");
            }
            return node.arg(index).accept(this, null);
        }

        private double number(FunctionNode node, int index) {
            return ValueCoercion.toNumber(arg(node, index));
        }

        private String text(FunctionNode node, int index) {
            return ValueCoercion.toText(arg(node, index));
        }

        private RangeValue range(FunctionNode node, int index) {
            Object value = arg(node, index);
            return value instanceof RangeValue range ? range : RangeValue.single(value);
        }

        /**
         * Every argument, ranges flattened into their cells.
         */
        private List<Object> values(FunctionNode node) {
            List<Object> values = new ArrayList<>();
            for (int i = 0; i < node.arity(); i++) {
                Object value = arg(node, i);
                if (value instanceof RangeValue range) {
                    values.addAll(range.flatten());
                } else {
                    values.add(value);
                }
            }
            return values;
        }

        private List<Double> numbers(FunctionNode node) {
            return values(node).stream().map(ValueCoercion::toNumber).toList();
        }

        private double round(FunctionNode node, RoundingMode mode) {
            double value = number(node, 0);
            int digits = node.arity() > 1 ? (int) number(node, 1) : 0;
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return value;
            }
            return BigDecimal.valueOf(value).setScale(digits, mode).doubleValue();
        }

        private Object conditional(FunctionNode node) {
            if (ValueCoercion.toBoolean(arg(node, 0))) {
                return node.arity() > 1 ? arg(node, 1) : Boolean.TRUE;
            }
            return node.arity() > 2 ? arg(node, 2) : Boolean.FALSE;
        }

        private Object firstTrue(FunctionNode node) {
            for (int i = 0; i + 1 < node.arity(); i += 2) {
                if (ValueCoercion.toBoolean(arg(node, i))) {
                    return arg(node, i + 1);
                }
            }
            return 0.0;
        }

        private Object fallbackOnError(FunctionNode node) {
            if (node.arg(0) instanceof ErrorNode) {
                return arg(node, 1);
            }
            Object value = arg(node, 0);
            if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
                return arg(node, 1);
            }
            return value;
        }

        private String concat(FunctionNode node) {
            StringBuilder text = new StringBuilder();
            values(node).forEach(value -> text.append(ValueCoercion.toText(value)));
            return text.toString();
        }

        private double sumIf(FunctionNode node) {
            List<Object> candidates = range(node, 0).flatten();
            Object criterion = arg(node, 1);
            List<Object> sums = node.arity() > 2 ? range(node, 2).flatten() : candidates;
            double total = 0;
            for (int i = 0; i < candidates.size() && i < sums.size(); i++) {
                if (CriteriaMatcher.matches(candidates.get(i), criterion)) {
                    total += ValueCoercion.toNumber(sums.get(i));
                }
            }
            return total;
        }

        private double sumIfs(FunctionNode node) {
            List<Object> sums = range(node, 0).flatten();
            double total = 0;
            for (int i : matchingRows(node, 1)) {
                if (i < sums.size()) {
                    total += ValueCoercion.toNumber(sums.get(i));
                }
            }
            return total;
        }

        private double averageIfs(FunctionNode node) {
            List<Object> values = range(node, 0).flatten();
            double total = 0;
            int count = 0;
            for (int i : matchingRows(node, 1)) {
                if (i < values.size()) {
                    total += ValueCoercion.toNumber(values.get(i));
                    count++;
                }
            }
            return count == 0 ? 0 : total / count;
        }

        /**
         * Positions satisfying every (range, criterion) pair starting at {@code first}.
         */
        private List<Integer> matchingRows(FunctionNode node, int first) {
            List<List<Object>> ranges = new ArrayList<>();
            List<Object> criteria = new ArrayList<>();
            for (int i = first; i + 1 < node.arity(); i += 2) {
                ranges.add(range(node, i).flatten());
                criteria.add(arg(node, i + 1));
            }
            if (ranges.isEmpty()) {
                throw new EvaluationAbort(node.name() + " expects range and criteria pairs");
            }
            int size = ranges.stream().mapToInt(List::size).max().orElse(0);
            List<Integer> rows = new ArrayList<>();
            for (int row = 0; row < size; row++) {
                boolean all = true;
                for (int pair = 0; pair < ranges.size() && all; pair++) {
                    List<Object> candidates = ranges.get(pair);
                    all = row < candidates.size() && CriteriaMatcher.matches(candidates.get(row), criteria.get(pair));
                }
                if (all) {
                    rows.add(row);
                }
            }
            return rows;
        }

        private int compare(Object left, Object right) {
            if (left instanceof String a && right instanceof String b) {
                return a.compareToIgnoreCase(b);
            }
            if (left instanceof Boolean a && right instanceof Boolean b) {
                return Boolean.compare(a, b);
            }
            return Double.compare(ValueCoercion.toNumber(left), ValueCoercion.toNumber(right));
        }
    }

    private static String left(String text, int count) {
        return text.substring(0, Math.max(0, Math.min(count, text.length())));
    }

    private static String right(String text, int count) {
        return text.substring(text.length() - Math.max(0, Math.min(count, text.length())));
    }

    private static String mid(String text, int start, int count) {
        int from = Math.max(0, start - 1);
        if (from >= text.length() || count <= 0) {
            return "";
        }
        return text.substring(from, (int) Math.min(text.length(), (long) from + count));
    }
}
