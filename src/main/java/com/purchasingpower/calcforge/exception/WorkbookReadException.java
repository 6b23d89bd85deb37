package com.purchasingpower.calcforge.exception;

import lombok.Getter;

/**
 * The workbook export could not be loaded. This is the only error that aborts a
 * whole compilation; every per-cell problem degrades to a typed result instead.
 */
@Getter
public class WorkbookReadException extends RuntimeException {

    private final String workbookPath;

    public WorkbookReadException(String message, String workbookPath) {
        super(message);
        this.workbookPath = workbookPath;
    }

    public WorkbookReadException(String message, String workbookPath, Throwable cause) {
        super(message, cause);
        this.workbookPath = workbookPath;
    }

}
