package com.purchasingpower.calcforge.formula;

import java.util.List;

/**
 * VLOOKUP, MATCH, INDEX and XLOOKUP over evaluated ranges. Lookups that find nothing
 * return 0.
 */
final class LookupFunctions {

    private static final Double NOT_FOUND = 0.0;

    private LookupFunctions() {
    }

    /**
     * @param approximate true for the default range lookup: the last row whose key is
     *                    not greater than {@code lookup}
     */
    static Object vlookup(Object lookup, RangeValue table, int column, boolean approximate) {
        if (column < 1 || column > table.columnCount()) {
            return NOT_FOUND;
        }
        int found = -1;
        for (int row = 1; row <= table.rowCount(); row++) {
            Object key = table.get(row, 1);
            if (approximate) {
                if (compare(key, lookup) <= 0) {
                    found = row;
                }
            } else if (matchesExactly(key, lookup)) {
                found = row;
                break;
            }
        }
        return found < 0 ? NOT_FOUND : table.get(found, column);
    }

    /**
     * @param matchType 1 largest value not above lookup, 0 exact, -1 smallest value not below lookup
     * @return one-based position, 0 when nothing matches
     */
    static double match(Object lookup, RangeValue range, int matchType) {
        List<Object> values = range.flatten();
        int best = -1;
        for (int i = 0; i < values.size(); i++) {
            Object candidate = values.get(i);
            if (matchType == 0) {
                if (matchesExactly(candidate, lookup)) {
                    return i + 1.0;
                }
            } else if (matchType > 0) {
                if (compare(candidate, lookup) <= 0 && (best < 0 || compare(candidate, values.get(best)) > 0)) {
                    best = i;
                }
            } else if (compare(candidate, lookup) >= 0 && (best < 0 || compare(candidate, values.get(best)) < 0)) {
                best = i;
            }
        }
        return best < 0 ? 0 : best + 1.0;
    }

    /**
     * One-based INDEX. A single row or column accepts a single position.
     */
    static Object index(RangeValue range, int row, Integer column) {
        Object value;
        if (column == null) {
            value = range.rowCount() == 1 ? range.get(1, row) : range.get(row, 1);
        } else {
            value = range.get(row, column);
        }
        return value == null ? NOT_FOUND : value;
    }

    /**
     * @param matchMode  0 exact, -1 exact or next smaller, 1 exact or next larger
     * @param searchMode negative searches last-to-first
     */
    static Object xlookup(Object lookup, RangeValue lookupArray, RangeValue returnArray,
                          Object notFound, int matchMode, int searchMode) {
        List<Object> keys = lookupArray.flatten();
        List<Object> results = returnArray.flatten();
        int best = -1;
        for (int step = 0; step < keys.size(); step++) {
            int i = searchMode < 0 ? keys.size() - 1 - step : step;
            Object key = keys.get(i);
            if (matchesExactly(key, lookup)) {
                best = i;
                break;
            }
            if (matchMode < 0 && compare(key, lookup) < 0
                    && (best < 0 || compare(key, keys.get(best)) > 0)) {
                best = i;
            } else if (matchMode > 0 && compare(key, lookup) > 0
                    && (best < 0 || compare(key, keys.get(best)) < 0)) {
                best = i;
            }
        }
        if (best < 0 || best >= results.size()) {
            return notFound == null ? NOT_FOUND : notFound;
        }
        return results.get(best);
    }

    static boolean matchesExactly(Object candidate, Object lookup) {
        if (ValueCoercion.isNumeric(candidate) && ValueCoercion.isNumeric(lookup)) {
            return ValueCoercion.toNumber(candidate) == ValueCoercion.toNumber(lookup);
        }
        if (candidate instanceof Boolean || lookup instanceof Boolean) {
            return candidate != null && candidate.equals(lookup);
        }
        String expected = ValueCoercion.toText(lookup);
        if (lookup instanceof String && CriteriaMatcher.hasWildcards(expected)) {
            return CriteriaMatcher.wildcardPattern(expected).matcher(ValueCoercion.toText(candidate)).matches();
        }
        return ValueCoercion.toText(candidate).equalsIgnoreCase(expected);
    }

    /**
     * Orders numbers before text; numbers numerically, text ignoring case.
     */
    static int compare(Object a, Object b) {
        boolean aNumeric = ValueCoercion.isNumeric(a);
        boolean bNumeric = ValueCoercion.isNumeric(b);
        if (aNumeric && bNumeric) {
            return Double.compare(ValueCoercion.toNumber(a), ValueCoercion.toNumber(b));
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return ValueCoercion.toText(a).compareToIgnoreCase(ValueCoercion.toText(b));
    }
}
