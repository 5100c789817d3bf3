package com.catmepim.chartsync.exception;

/**
 * A part or relationship the operation depends on could not be located:
 * missing chart part, missing or unparsable {@code .rels} part, absent {@code externalData}
 * reference, unknown relationship ID or a relationship target that does not exist.
 */
public class PartResolutionException extends ChartSyncException {

    private static final long serialVersionUID = 1L;

    public PartResolutionException(ErrorCode code, String message) {
        super(code, message);
    }

    public PartResolutionException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
