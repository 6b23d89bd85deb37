package com.purchasingpower.calcforge.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the {@code Sheet!A1} / {@code Sheet!A1:B2} address format shared by
 * every stage of the compiler.
 *
 * <p>Normalized addresses never carry {@code $} markers or sheet quotes, and their
 * column letters are upper-case.
 */
public final class CellAddresses {

    private static final Pattern CELL = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?(\\d+)$");

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Za-z0-9_]");

    private CellAddresses() {
    }

    /**
     * Normalizes a cell or range reference: strips {@code $} markers and sheet quotes
     * and qualifies sheet-less references with {@code defaultSheet}.
     *
     * @param reference    raw reference text, e.g. {@code 'My Sheet'!$B$2} or {@code b2:c4}
     * @param defaultSheet sheet used when the reference has none; may be null
     * @return normalized reference; unqualified when there is no sheet to apply
     */
    public static String normalize(String reference, String defaultSheet) {
        String text = reference.trim();
        String sheet = defaultSheet;
        int bang = text.lastIndexOf('!');
        if (bang >= 0) {
            sheet = unquoteSheet(text.substring(0, bang));
            text = text.substring(bang + 1);
        }
        String local = text.replace("$", "").toUpperCase(Locale.ROOT);
        if (sheet == null || sheet.isEmpty()) {
            return local;
        }
        return sheet + "!" + local;
    }

    /**
     * {@code 'Q1 ''Plan'''} becomes {@code Q1 'Plan'}.
     */
    public static String unquoteSheet(String sheet) {
        String trimmed = sheet.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("''", "'");
        }
        return trimmed;
    }

    public static String qualify(String sheet, String coordinate) {
        return sheet + "!" + coordinate.replace("$", "").toUpperCase(Locale.ROOT);
    }

    public static String qualify(String sheet, CellPosition position) {
        return sheet + "!" + coordinate(position);
    }

    /**
     * Sheet part of an address, or null for an unqualified address.
     */
    public static String sheetOf(String address) {
        int bang = address.lastIndexOf('!');
        return bang < 0 ? null : address.substring(0, bang);
    }

    /**
     * Coordinate part of an address ({@code A1} or {@code A1:B2}).
     */
    public static String localPart(String address) {
        int bang = address.lastIndexOf('!');
        return bang < 0 ? address : address.substring(bang + 1);
    }

    public static boolean isRange(String address) {
        return localPart(address).contains(":");
    }

    /**
     * Parses a single-cell coordinate such as {@code B12} or {@code Sheet1!$B$12}.
     */
    public static Optional<CellPosition> position(String address) {
        Matcher matcher = CELL.matcher(localPart(address));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new CellPosition(Integer.parseInt(matcher.group(2)), columnIndex(matcher.group(1))));
    }

    public static String coordinate(CellPosition position) {
        return columnLetters(position.column()) + position.row();
    }

    /**
     * {@code A} is 1, {@code Z} is 26, {@code AA} is 27.
     */
    public static int columnIndex(String letters) {
        int index = 0;
        for (char c : letters.toUpperCase(Locale.ROOT).toCharArray()) {
            index = index * 26 + (c - 'A' + 1);
        }
        return index;
    }

    public static String columnLetters(int column) {
        StringBuilder letters = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            letters.insert(0, (char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return letters.toString();
    }

    /**
     * Identifier-safe form of an address used for generated field ids and column names:
     * {@code Sheet 1!B2} becomes {@code Sheet_1_B2}.
     */
    public static String toIdentifier(String address) {
        return NON_IDENTIFIER.matcher(address).replaceAll("_");
    }
}
