package com.catmepim.chartsync.exception;

/**
 * Structural parse failure of a chart or workbook part. Aborts the whole operation.
 */
public class ChartParseException extends ChartSyncException {

    private static final long serialVersionUID = 1L;

    public ChartParseException(ErrorCode code, String message) {
        super(code, message);
    }

    public ChartParseException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
