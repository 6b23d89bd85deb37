package com.purchasingpower.calcforge.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-pass lexer for spreadsheet formulas.
 *
 * <p>At every position the token patterns are tried in a fixed order; the first one
 * that matches wins. Characters no pattern accepts are skipped and reported.
 * Whitespace separates tokens and is not emitted.
 */
public class FormulaTokenizer {

    private static final String SHEET = "(?:'(?:[^']|'')+'|[A-Za-z_][A-Za-z0-9_.]*)!";
    private static final String CELL = "\\$?[A-Za-z]{1,3}\\$?\\d+";
    private static final String NOT_IDENTIFIER = "(?![A-Za-z0-9_(.])";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<Rule> RULES = List.of(
            new Rule(TokenType.NUMBER, "(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?"),
            new Rule(TokenType.STRING, "\"(?:[^\"]|\"\")*\""),
            new Rule(TokenType.ERROR_LITERAL, "#(?:NULL!|DIV/0!|VALUE!|REF!|NAME\\?|NUM!|N/A)"),
            new Rule(TokenType.RANGE, "(?:" + SHEET + ")?(?:" + CELL + ":" + CELL
                    + "|\\$?[A-Za-z]{1,3}:\\$?[A-Za-z]{1,3})" + NOT_IDENTIFIER),
            new Rule(TokenType.OPERATOR, "<>|>=|<=|=|>|<|\\+|-|\\*|/|\\^|&|%"),
            new Rule(TokenType.SEPARATOR, "[,;]"),
            new Rule(TokenType.LPAREN, "\\("),
            new Rule(TokenType.RPAREN, "\\)"),
            new Rule(TokenType.REFERENCE, "(?:" + SHEET + ")?" + CELL + NOT_IDENTIFIER),
            new Rule(TokenType.NAME, "[A-Za-z_\\\\][A-Za-z0-9_.]*"));

    /**
     * @param formula formula text with or without the leading {@code =}
     */
    public TokenizationResult tokenize(String formula) {
        String text = stripEquals(formula);
        List<Token> tokens = new ArrayList<>();
        List<FormulaDiagnostic> diagnostics = new ArrayList<>();

        int position = 0;
        while (position < text.length()) {
            Matcher whitespace = WHITESPACE.matcher(text).region(position, text.length());
            if (whitespace.lookingAt()) {
                position = whitespace.end();
                continue;
            }
            Token token = match(text, position);
            if (token == null) {
                diagnostics.add(new FormulaDiagnostic(FormulaDiagnostic.Kind.UNKNOWN_CHARACTER,
                        "Unrecognized character '" + text.charAt(position) + "'", position));
                position++;
                continue;
            }
            tokens.add(token);
            position += token.text().length();
        }
        return new TokenizationResult(tokens, diagnostics);
    }

    public static String stripEquals(String formula) {
        if (formula == null) {
            return "";
        }
        String trimmed = formula.trim();
        return trimmed.startsWith("=") ? trimmed.substring(1) : trimmed;
    }

    /**
     * Value of a string token: quotes removed, doubled quotes collapsed.
     */
    public static String unquote(Token token) {
        String text = token.text();
        return text.substring(1, text.length() - 1).replace("\"\"", "\"");
    }

    private Token match(String text, int position) {
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(text).region(position, text.length());
            if (matcher.lookingAt()) {
                return new Token(rule.type(), matcher.group(), position);
            }
        }
        return null;
    }

    private record Rule(TokenType type, Pattern pattern) {

        Rule(TokenType type, String regex) {
            this(type, Pattern.compile(regex));
        }
    }
}
