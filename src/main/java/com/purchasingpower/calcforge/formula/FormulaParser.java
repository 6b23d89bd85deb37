package com.purchasingpower.calcforge.formula;

import com.purchasingpower.calcforge.formula.ast.BinaryNode;
import com.purchasingpower.calcforge.formula.ast.BinaryOp;
import com.purchasingpower.calcforge.formula.ast.ErrorNode;
import com.purchasingpower.calcforge.formula.ast.FormulaNode;
import com.purchasingpower.calcforge.formula.ast.FunctionNode;
import com.purchasingpower.calcforge.formula.ast.NumberNode;
import com.purchasingpower.calcforge.formula.ast.RangeNode;
import com.purchasingpower.calcforge.formula.ast.ReferenceNode;
import com.purchasingpower.calcforge.formula.ast.StringNode;
import com.purchasingpower.calcforge.formula.ast.UnaryNode;
import com.purchasingpower.calcforge.formula.ast.UnaryOp;
import com.purchasingpower.calcforge.model.logic.ParsedFormula;
import com.purchasingpower.calcforge.util.CellAddresses;
import lombok.RequiredArgsConstructor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Operator-precedence (shunting-yard) parser producing {@link FormulaNode} trees.
 *
 * <p>Parsing is total: a missing operand becomes an {@link ErrorNode} and a diagnostic,
 * never an exception.
 */
@RequiredArgsConstructor
public class FormulaParser {

    private static final int PREFIX_PRECEDENCE = 5;

    private final FormulaTokenizer tokenizer;
    private final RangeExpander rangeExpander;

    /**
     * Parses the formula held by {@code target} and collects its functions, references
     * and constants.
     */
    public ParsedFormula parse(String target, String formula, ReferenceResolutionContext context) {
        TokenizationResult tokenization = tokenizer.tokenize(formula);
        List<FormulaDiagnostic> diagnostics = new ArrayList<>(tokenization.diagnostics());
        FormulaNode ast = new Run(tokenization.tokens(), context, diagnostics).parse();

        FormulaFacts facts = FormulaFacts.of(ast, rangeExpander);
        return ParsedFormula.builder()
                .target(target)
                .raw(formula)
                .ast(ast)
                .functions(facts.functions())
                .references(facts.references())
                .constants(facts.constants())
                .diagnostics(List.copyOf(diagnostics))
                .build();
    }

    public FormulaNode parseExpression(String formula, ReferenceResolutionContext context) {
        return parse(null, formula, context).getAst();
    }

    /**
     * Normalized references named by the formula's tokens, without building an AST.
     * Unresolvable names and unknown characters are skipped.
     */
    public List<String> referenceTokens(String formula, ReferenceResolutionContext context) {
        List<Token> tokens = tokenizer.tokenize(formula).tokens();
        Set<String> references = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case REFERENCE, RANGE -> references.add(context.normalize(token.text()));
                case NAME -> {
                    boolean call = i + 1 < tokens.size() && tokens.get(i + 1).is(TokenType.LPAREN);
                    if (!call) {
                        context.resolveName(token.text()).ifPresent(references::add);
                    }
                }
                default -> {
                }
            }
        }
        return List.copyOf(references);
    }

    static String functionName(String token) {
        String name = token.toUpperCase(Locale.ROOT);
        for (String prefix : List.of("_XLFN._XLWS.", "_XLFN.", "_XLWS.")) {
            if (name.startsWith(prefix)) {
                return name.substring(prefix.length());
            }
        }
        return name;
    }

    /**
     * Parser state for one formula.
     */
    private static final class Run {

        private final List<Token> tokens;
        private final ReferenceResolutionContext context;
        private final List<FormulaDiagnostic> diagnostics;

        private final Deque<FormulaNode> output = new ArrayDeque<>();
        private final Deque<Frame> frames = new ArrayDeque<>();

        Run(List<Token> tokens, ReferenceResolutionContext context, List<FormulaDiagnostic> diagnostics) {
            this.tokens = tokens;
            this.context = context;
            this.diagnostics = diagnostics;
        }

        FormulaNode parse() {
            if (tokens.isEmpty()) {
                return new ErrorNode("empty formula");
            }
            boolean expectOperand = true;
            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                switch (token.type()) {
                    case NUMBER, STRING, ERROR_LITERAL, REFERENCE, RANGE -> {
                        pushOperand(operand(token), token, expectOperand);
                        expectOperand = false;
                    }
                    case NAME -> {
                        if (i + 1 < tokens.size() && tokens.get(i + 1).is(TokenType.LPAREN)) {
                            frames.push(Frame.function(functionName(token.text()), output.size(), token.position()));
                            i++;
                            expectOperand = true;
                        } else {
                            pushOperand(name(token), token, expectOperand);
                            expectOperand = false;
                        }
                    }
                    case OPERATOR -> expectOperand = operator(token, expectOperand);
                    case LPAREN -> {
                        if (!expectOperand) {
                            report(FormulaDiagnostic.Kind.UNEXPECTED_OPERAND, "Unexpected '('", token);
                        }
                        frames.push(Frame.paren(output.size(), token.position()));
                        expectOperand = true;
                    }
                    case SEPARATOR -> {
                        if (expectOperand) {
                            missingOperand("argument", token);
                        }
                        reduceToGroup();
                        if (frames.isEmpty() || !frames.peek().isFunction()) {
                            report(FormulaDiagnostic.Kind.UNEXPECTED_OPERAND, "Separator outside a function call", token);
                        }
                        expectOperand = true;
                    }
                    case RPAREN -> {
                        closeGroup(token, expectOperand);
                        expectOperand = false;
                    }
                }
            }
            if (expectOperand) {
                missingOperand("operand at end of formula", tokens.get(tokens.size() - 1));
            }
            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                if (frame.isGroup()) {
                    diagnostics.add(new FormulaDiagnostic(FormulaDiagnostic.Kind.UNBALANCED_PARENTHESIS,
                            "Missing ')'", frame.position));
                    frames.pop();
                    if (frame.isFunction()) {
                        output.push(new FunctionNode(frame.name, popArguments(frame)));
                    }
                } else {
                    reduce();
                }
            }
            if (output.size() == 1) {
                return output.pop();
            }
            diagnostics.add(new FormulaDiagnostic(FormulaDiagnostic.Kind.UNEXPECTED_OPERAND,
                    "Expression has " + output.size() + " values where one was expected", 0));
            return new ErrorNode("malformed expression");
        }

        private boolean operator(Token token, boolean expectOperand) {
            String symbol = token.text();
            if (symbol.equals("%")) {
                if (expectOperand) {
                    missingOperand("operand before '%'", token);
                }
                output.push(new UnaryNode(UnaryOp.PERCENT, popOperand()));
                return false;
            }
            if (expectOperand && (symbol.equals("-") || symbol.equals("+"))) {
                frames.push(Frame.prefix(symbol.equals("-") ? UnaryOp.NEGATE : UnaryOp.PLUS, token.position()));
                return true;
            }
            BinaryOp op = BinaryOp.fromSymbol(symbol).orElseThrow();
            if (expectOperand) {
                missingOperand("operand before '" + symbol + "'", token);
            }
            while (!frames.isEmpty() && frames.peek().isOperator() && frames.peek().precedence() >= op.getPrecedence()) {
                reduce();
            }
            frames.push(Frame.infix(op, token.position()));
            return true;
        }

        private void closeGroup(Token token, boolean expectOperand) {
            reduceToGroup();
            if (frames.isEmpty()) {
                report(FormulaDiagnostic.Kind.UNBALANCED_PARENTHESIS, "Unmatched ')'", token);
                return;
            }
            Frame frame = frames.pop();
            if (frame.isFunction()) {
                boolean emptyCall = expectOperand && output.size() == frame.outputMark;
                if (expectOperand && !emptyCall) {
                    missingOperand("argument", token);
                }
                output.push(new FunctionNode(frame.name, popArguments(frame)));
                return;
            }
            if (expectOperand) {
                missingOperand("expression inside parentheses", token);
            }
            if (output.size() - frame.outputMark > 1) {
                report(FormulaDiagnostic.Kind.UNEXPECTED_OPERAND, "Parentheses hold more than one value", token);
            }
        }

        private List<FormulaNode> popArguments(Frame frame) {
            List<FormulaNode> args = new ArrayList<>();
            while (output.size() > frame.outputMark) {
                args.add(0, output.pop());
            }
            return args;
        }

        private void reduceToGroup() {
            while (!frames.isEmpty() && frames.peek().isOperator()) {
                reduce();
            }
        }

        private void reduce() {
            Frame frame = frames.pop();
            if (frame.unary != null) {
                output.push(new UnaryNode(frame.unary, popOperand()));
                return;
            }
            FormulaNode right = popOperand();
            FormulaNode left = popOperand();
            output.push(new BinaryNode(frame.binary, left, right));
        }

        private FormulaNode popOperand() {
            if (output.isEmpty()) {
                return new ErrorNode("missing operand");
            }
            return output.pop();
        }

        private void pushOperand(FormulaNode node, Token token, boolean expectOperand) {
            if (!expectOperand) {
                report(FormulaDiagnostic.Kind.UNEXPECTED_OPERAND, "Unexpected '" + token.text() + "'", token);
            }
            output.push(node);
        }

        private void missingOperand(String what, Token token) {
            report(FormulaDiagnostic.Kind.MISSING_OPERAND, "Missing " + what, token);
            output.push(new ErrorNode("missing " + what));
        }

        private void report(FormulaDiagnostic.Kind kind, String message, Token token) {
            diagnostics.add(new FormulaDiagnostic(kind, message, token.position()));
        }

        private FormulaNode operand(Token token) {
            return switch (token.type()) {
                case NUMBER -> new NumberNode(Double.parseDouble(token.text()));
                case STRING -> new StringNode(FormulaTokenizer.unquote(token));
                case ERROR_LITERAL -> new ErrorNode("error literal " + token.text());
                case REFERENCE -> new ReferenceNode(context.normalize(token.text()));
                case RANGE -> new RangeNode(context.normalize(token.text()));
                default -> throw new IllegalArgumentException("Not an operand token: " + token);
            };
        }

        private FormulaNode name(Token token) {
            String upper = token.text().toUpperCase(Locale.ROOT);
            if (upper.equals("TRUE") || upper.equals("FALSE")) {
                return new FunctionNode(upper, List.of());
            }
            return context.resolveName(token.text())
                    .<FormulaNode>map(target -> CellAddresses.isRange(target) ? new RangeNode(target) : new ReferenceNode(target))
                    .orElseGet(() -> {
                        report(FormulaDiagnostic.Kind.UNRESOLVED_NAME, "Unknown name '" + token.text() + "'", token);
                        return new ErrorNode("unresolved name " + token.text());
                    });
        }
    }

    /**
     * Entry of the operator stack: an infix operator, a prefix operator, an open
     * parenthesis or an open function call.
     */
    private static final class Frame {

        private final BinaryOp binary;
        private final UnaryOp unary;
        private final String name;
        private final boolean paren;
        private final int outputMark;
        private final int position;

        private Frame(BinaryOp binary, UnaryOp unary, String name, boolean paren, int outputMark, int position) {
            this.binary = binary;
            this.unary = unary;
            this.name = name;
            this.paren = paren;
            this.outputMark = outputMark;
            this.position = position;
        }

        static Frame infix(BinaryOp op, int position) {
            return new Frame(op, null, null, false, -1, position);
        }

        static Frame prefix(UnaryOp op, int position) {
            return new Frame(null, op, null, false, -1, position);
        }

        static Frame paren(int outputMark, int position) {
            return new Frame(null, null, null, true, outputMark, position);
        }

        static Frame function(String name, int outputMark, int position) {
            return new Frame(null, null, name, false, outputMark, position);
        }

        boolean isOperator() {
            return binary != null || unary != null;
        }

        boolean isFunction() {
            return name != null;
        }

        boolean isGroup() {
            return paren || name != null;
        }

        int precedence() {
            return unary != null ? PREFIX_PRECEDENCE : binary.getPrecedence();
        }
    }

    /**
     * Functions, references and constants of a finished tree.
     */
    private record FormulaFacts(List<String> functions, List<String> references, List<Object> constants) {

        static FormulaFacts of(FormulaNode root, RangeExpander expander) {
            Set<String> functions = new LinkedHashSet<>();
            Set<String> references = new TreeSet<>();
            List<Object> constants = new ArrayList<>();
            collect(root, expander, functions, references, constants);
            return new FormulaFacts(List.copyOf(functions), List.copyOf(references), List.copyOf(constants));
        }

        private static void collect(FormulaNode node, RangeExpander expander, Set<String> functions,
                                    Set<String> references, List<Object> constants) {
            if (node instanceof NumberNode number) {
                constants.add(number.value());
            } else if (node instanceof StringNode text) {
                constants.add(text.value());
            } else if (node instanceof ReferenceNode reference) {
                references.add(reference.address());
            } else if (node instanceof RangeNode range) {
                references.addAll(expander.expand(range.range()));
            } else if (node instanceof UnaryNode unary) {
                collect(unary.operand(), expander, functions, references, constants);
            } else if (node instanceof BinaryNode binary) {
                collect(binary.left(), expander, functions, references, constants);
                collect(binary.right(), expander, functions, references, constants);
            } else if (node instanceof FunctionNode function) {
                if (!function.name().equals("TRUE") && !function.name().equals("FALSE")) {
                    functions.add(function.name());
                }
                for (FormulaNode arg : function.args()) {
                    collect(arg, expander, functions, references, constants);
                }
            }
        }
    }
}
