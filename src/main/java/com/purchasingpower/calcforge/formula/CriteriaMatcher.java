package com.purchasingpower.calcforge.formula;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Criteria of SUMIF, COUNTIF and friends.
 *
 * <p>A criterion is a bare value ({@code 1}, {@code "North"}), a comparison written
 * as text ({@code ">=100"}, {@code "<>Closed"}) or a wildcard pattern ({@code "A*"},
 * {@code "?x"}). Text comparisons ignore case.
 */
public final class CriteriaMatcher {

    private static final Pattern COMPARISON = Pattern.compile("^(>=|<=|<>|=|>|<)(.*)$", Pattern.DOTALL);

    private CriteriaMatcher() {
    }

    public static boolean matches(Object value, Object criterion) {
        if (criterion instanceof Boolean expected) {
            return value instanceof Boolean actual && actual.equals(expected);
        }
        if (criterion instanceof Number number) {
            return ValueCoercion.isNumeric(value) && ValueCoercion.toNumber(value) == number.doubleValue();
        }
        String text = ValueCoercion.toText(criterion);
        Matcher comparison = COMPARISON.matcher(text);
        if (comparison.matches()) {
            return compare(value, comparison.group(1), comparison.group(2));
        }
        return equalsCriterion(value, text);
    }

    private static boolean compare(Object value, String operator, String operand) {
        if (operator.equals("=")) {
            return operand.isEmpty() ? isBlank(value) : equalsCriterion(value, operand);
        }
        if (operator.equals("<>")) {
            return operand.isEmpty() ? !isBlank(value) : !equalsCriterion(value, operand);
        }
        int order;
        if (ValueCoercion.isNumeric(operand) && ValueCoercion.isNumeric(value)) {
            order = Double.compare(ValueCoercion.toNumber(value), ValueCoercion.parseNumber(operand));
        } else if (value instanceof String) {
            order = ValueCoercion.toText(value).compareToIgnoreCase(operand);
        } else {
            return false;
        }
        return switch (operator) {
            case ">" -> order > 0;
            case ">=" -> order >= 0;
            case "<" -> order < 0;
            default -> order <= 0;
        };
    }

    private static boolean equalsCriterion(Object value, String criterion) {
        if (hasWildcards(criterion)) {
            return wildcardPattern(criterion).matcher(ValueCoercion.toText(value)).matches();
        }
        if (ValueCoercion.isNumeric(criterion) && ValueCoercion.isNumeric(value)) {
            return ValueCoercion.toNumber(value) == ValueCoercion.parseNumber(criterion);
        }
        return ValueCoercion.toText(value).equalsIgnoreCase(criterion);
    }

    static boolean hasWildcards(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0;
    }

    /**
     * {@code *} matches any run of characters, {@code ?} any single character and
     * {@code ~} escapes the next character.
     */
    static Pattern wildcardPattern(String criterion) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < criterion.length(); i++) {
            char c = criterion.charAt(i);
            if (c == '~' && i + 1 < criterion.length()) {
                regex.append(Pattern.quote(String.valueOf(criterion.charAt(++i))));
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private static boolean isBlank(Object value) {
        return value == null || ValueCoercion.toText(value).trim().isEmpty();
    }
}
