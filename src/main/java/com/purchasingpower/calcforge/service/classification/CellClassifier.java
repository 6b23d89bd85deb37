package com.purchasingpower.calcforge.service.classification;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;

/**
 * First compiler stage: decides what every non-empty cell is for.
 */
public interface CellClassifier {

    /**
     * Assigns each non-empty cell a role and collects the workbook-level facts
     * (named ranges, validations, conditional formats, pivots, macros).
     *
     * <p>Malformed formulas never fail classification; their unreadable parts are
     * left out of the cell's references.
     *
     * @param workbook reader export of one workbook
     * @return immutable classification
     * @throws com.purchasingpower.calcforge.exception.WorkbookReadException if the workbook has no sheets
     */
    CellClassificationResult classify(WorkbookStructure workbook);
}
