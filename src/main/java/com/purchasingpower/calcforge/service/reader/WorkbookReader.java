package com.purchasingpower.calcforge.service.reader;

import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;

import java.nio.file.Path;

/**
 * Loads a workbook export produced by the external spreadsheet reader.
 */
public interface WorkbookReader {

    /**
     * @throws com.purchasingpower.calcforge.exception.WorkbookReadException if the file is
     *         missing, cannot be parsed or contains no sheets
     */
    WorkbookStructure read(Path path);
}
