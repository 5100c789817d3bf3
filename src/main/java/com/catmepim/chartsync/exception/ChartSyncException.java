package com.catmepim.chartsync.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for all chart synchronization failures.
 * <p>
 * Every instance carries an {@link ErrorCode} and an ordered context map (chart index,
 * relationship ID, part name, ...) that is rendered into {@link #getMessage()} so the caller
 * always sees which chart or relationship the failure belongs to.
 *
 * @invariant code != null
 */
public class ChartSyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final Map<String, Object> context = new LinkedHashMap<>();

    /**
     * Constructs a new ChartSyncException with the specified code and detail message.
     *
     * @param code the error classification
     * @param message the detail message
     */
    public ChartSyncException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Constructs a new ChartSyncException with the specified code, detail message and cause.
     *
     * @param code the error classification
     * @param message the detail message
     * @param cause the cause
     */
    public ChartSyncException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Attaches a context entry and returns this exception for chaining.
     *
     * @param key context key, e.g. {@code chartIndex}
     * @param value context value
     * @return this exception
     * @post getContext().get(key) == value
     */
    public ChartSyncException withContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(code).append(": ").append(super.getMessage());
        if (!context.isEmpty()) {
            sb.append(' ').append(context);
        }
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append(": ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
