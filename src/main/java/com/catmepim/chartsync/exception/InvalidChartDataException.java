package com.catmepim.chartsync.exception;

/**
 * Thrown when chart data fails structural validation (empty categories or series,
 * blank series names, series/category length mismatch, non-finite values).
 * Raised by data inspection alone, before any package part is read or written.
 */
public class InvalidChartDataException extends ChartSyncException {

    private static final long serialVersionUID = 1L;

    public InvalidChartDataException(String message) {
        super(ErrorCode.INVALID_CHART_DATA, message);
    }
}
