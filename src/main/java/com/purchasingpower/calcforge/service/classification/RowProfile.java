package com.purchasingpower.calcforge.service.classification;

/**
 * Population of one sheet row. Formula cells count as neither text nor numbers.
 */
public record RowProfile(int nonEmpty, int text, int numeric) {

    public static final RowProfile EMPTY = new RowProfile(0, 0, 0);

    public RowProfile add(Object value, boolean formula) {
        if (formula) {
            return new RowProfile(nonEmpty + 1, text, numeric);
        }
        boolean isText = value instanceof String;
        boolean isNumber = value instanceof Number;
        return new RowProfile(nonEmpty + 1, text + (isText ? 1 : 0), numeric + (isNumber ? 1 : 0));
    }
}
