package com.catmepim.chartsync.exception;

/**
 * Classifies every failure surfaced by the chart synchronization engine.
 */
public enum ErrorCode {
    /** Chart data rejected before any part was touched. */
    INVALID_CHART_DATA,
    /** No {@code chart{N}.xml} part exists for the requested index. */
    CHART_NOT_FOUND,
    /** A required package part (document, relationships, content types) is missing. */
    PART_NOT_FOUND,
    /** A relationship could not be followed to an existing part. */
    RELATIONSHIP_NOT_FOUND,
    /** The chart carries no {@code externalData} reference to a workbook. */
    EXTERNAL_DATA_MISSING,
    /** The relationship resolved, but the embedded workbook part is absent. */
    WORKBOOK_NOT_FOUND,
    /** The XML of a part could not be parsed at all. */
    XML_PARSE,
    /** The chart part is missing its chartSpace root or its chart-type element. */
    INVALID_CHART_STRUCTURE,
    /** Scatter categories that cannot be read as numeric X values. */
    NON_NUMERIC_SCATTER_CATEGORY,
    /** The embedded workbook is structurally unusable (no worksheet, no sheetData). */
    INVALID_WORKBOOK,
    /** The document part does not contain the drawing that should anchor a copy. */
    DRAWING_NOT_FOUND,
    /** Underlying storage failure. */
    IO
}
