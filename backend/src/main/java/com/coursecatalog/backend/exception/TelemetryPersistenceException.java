package com.coursecatalog.backend.exception;

/**
 * Raised when the telemetry document cannot be written or read back.
 */
public class TelemetryPersistenceException extends RuntimeException {
    public TelemetryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
