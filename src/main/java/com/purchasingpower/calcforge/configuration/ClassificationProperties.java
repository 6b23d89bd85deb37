package com.purchasingpower.calcforge.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds used to promote static text cells to structural headings.
 *
 * <p>None of these values has a formal derivation; they reproduce what works on
 * typical calculator workbooks and can be tuned per deployment.
 */
@Data
public class ClassificationProperties {

    /**
     * Bold static text is treated as a heading.
     */
    private boolean boldIsStructural = true;

    /**
     * A row with at most this many non-empty cells is a heading row.
     */
    @Min(0)
    private int sparseRowMaxCells = 1;

    /**
     * A row with at least this many text cells and no numbers is a heading row.
     */
    @Min(1)
    private int textRowMinTextCells = 2;

    /**
     * Dense row: populated to at least this share of the sheet's fullest row.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double denseRowPopulationRatio = 0.7;

    /**
     * Dense row: absolute minimum number of non-empty cells.
     */
    @Min(1)
    private int denseRowMinCells = 3;

    /**
     * Share of text cells that turns a dense row into a header row.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double denseRowTextRatio = 0.8;

    /**
     * Upper-case text at least this long reads as a heading.
     */
    @Min(1)
    private int headingUppercaseMinLength = 4;

    /**
     * Lower-cased prefixes that mark a heading ("Total cost", "Summary").
     */
    private List<String> headingPrefixes = new ArrayList<>(List.of("total", "summary", "subtotal"));
}
