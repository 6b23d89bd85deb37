package com.purchasingpower.calcforge.formula;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Conversions between the loosely typed values spreadsheet formulas operate on.
 *
 * <p>Text is read as a number the way a user typed it: {@code "$1,234.50"},
 * {@code "1.234,50 €"} and {@code "12,5%"} all parse. Whichever of {@code .} and
 * {@code ,} comes last is the decimal separator; anything unparsable is 0.
 */
public final class ValueCoercion {

    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("[$€£¥₩₽₹₺₫₱₦₴₪₡₲₵₸]");
    private static final Pattern CURRENCY_CODES =
            Pattern.compile("(?i)\\b(USD|EUR|GBP|JPY|MXN|COP|CLP|PEN|BRL|ARS|CAD|AUD)\\b");
    private static final Pattern SPACES = Pattern.compile("[\\s\\u00A0\\u202F]+");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private ValueCoercion() {
    }

    public static double toNumber(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        if (value instanceof RangeValue range) {
            double total = 0;
            for (Object cell : range.flatten()) {
                total += toNumber(cell);
            }
            return total;
        }
        return parseNumber(value.toString());
    }

    /**
     * Locale-tolerant parse of user-entered numeric text; 0 when the text is not a number.
     */
    public static double parseNumber(String text) {
        String cleaned = text.trim();
        if (cleaned.isEmpty()) {
            return 0;
        }
        boolean percent = cleaned.endsWith("%");
        if (percent) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        cleaned = CURRENCY_CODES.matcher(cleaned).replaceAll("");
        cleaned = CURRENCY_SYMBOLS.matcher(cleaned).replaceAll("");
        cleaned = SPACES.matcher(cleaned).replaceAll("");
        cleaned = normalizeSeparators(cleaned);
        if (!PLAIN_NUMBER.matcher(cleaned).matches()) {
            return 0;
        }
        double parsed = Double.parseDouble(cleaned);
        return percent ? parsed / 100 : parsed;
    }

    /**
     * True for numbers and for text that reads as a plain number.
     */
    public static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof String text) {
            String cleaned = normalizeSeparators(SPACES.matcher(text.trim()).replaceAll(""));
            return PLAIN_NUMBER.matcher(cleaned).matches();
        }
        return false;
    }

    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof Number number) {
            return formatNumber(number.doubleValue());
        }
        if (value instanceof RangeValue range) {
            List<Object> cells = range.flatten();
            return cells.isEmpty() ? "" : toText(cells.get(0));
        }
        return value.toString();
    }

    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.equalsIgnoreCase("TRUE")) {
                return true;
            }
            if (trimmed.equalsIgnoreCase("FALSE")) {
                return false;
            }
        }
        return toNumber(value) != 0;
    }

    /**
     * {@code 10.0} prints as {@code 10}, {@code 0.1} as {@code 0.1}.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Numbers become doubles; other values pass through.
     */
    public static Object normalize(Object value) {
        if (value instanceof Number number && !(value instanceof Double)) {
            return number.doubleValue();
        }
        return value;
    }

    private static String normalizeSeparators(String text) {
        int lastDot = text.lastIndexOf('.');
        int lastComma = text.lastIndexOf(',');
        if (lastDot >= 0 && lastComma >= 0) {
            if (lastComma > lastDot) {
                return text.replace(".", "").replace(',', '.');
            }
            return text.replace(",", "");
        }
        if (lastComma >= 0) {
            return count(text, ',') > 1 ? text.replace(",", "") : text.replace(',', '.');
        }
        if (lastDot >= 0 && count(text, '.') > 1) {
            return text.replace(".", "");
        }
        return text;
    }

    private static int count(String text, char c) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
