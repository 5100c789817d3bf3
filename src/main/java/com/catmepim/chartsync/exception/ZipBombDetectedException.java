package com.catmepim.chartsync.exception;

import java.io.IOException;

/**
 * Exception thrown when an archive entry exceeds the configured size or inflation limits
 * while a package is being extracted.
 */
public class ZipBombDetectedException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new ZipBombDetectedException with the specified detail message.
     *
     * @param message The detail message
     */
    public ZipBombDetectedException(String message) {
        super(message);
    }

    /**
     * Constructs a new ZipBombDetectedException with the specified detail message and cause.
     *
     * @param message The detail message
     * @param cause The cause
     */
    public ZipBombDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
