package com.purchasingpower.calcforge.service.classification;

import com.purchasingpower.calcforge.configuration.ClassificationProperties;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Decides whether a static text cell is a heading rather than a plain label.
 */
@RequiredArgsConstructor
public class StructuralHeuristics {

    private final ClassificationProperties properties;

    /**
     * @param maxNonEmpty population of the sheet's fullest row
     */
    public boolean isStructural(String text, boolean bold, boolean mergedAnchor, RowProfile row, int maxNonEmpty) {
        if (mergedAnchor) {
            return true;
        }
        if (bold && properties.isBoldIsStructural()) {
            return true;
        }
        if (row.nonEmpty() <= properties.getSparseRowMaxCells()) {
            return true;
        }
        if (row.text() >= properties.getTextRowMinTextCells() && row.numeric() == 0) {
            return true;
        }
        if (isDenseHeaderRow(row, maxNonEmpty)) {
            return true;
        }
        return looksLikeHeading(text);
    }

    private boolean isDenseHeaderRow(RowProfile row, int maxNonEmpty) {
        if (maxNonEmpty <= 0) {
            return false;
        }
        int minPopulation = Math.max(properties.getDenseRowMinCells(),
                (int) (maxNonEmpty * properties.getDenseRowPopulationRatio()));
        int minText = Math.max(properties.getTextRowMinTextCells(),
                (int) (row.nonEmpty() * properties.getDenseRowTextRatio()));
        return row.nonEmpty() >= minPopulation && row.text() >= minText;
    }

    public boolean looksLikeHeading(String text) {
        String trimmed = text.trim();
        if (trimmed.endsWith(":")) {
            return true;
        }
        boolean hasLetters = trimmed.chars().anyMatch(Character::isLetter);
        if (hasLetters && trimmed.length() >= properties.getHeadingUppercaseMinLength()
                && trimmed.equals(trimmed.toUpperCase(Locale.ROOT))) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return properties.getHeadingPrefixes().stream().anyMatch(lower::startsWith);
    }
}
