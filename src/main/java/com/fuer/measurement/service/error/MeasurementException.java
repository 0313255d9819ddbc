package com.fuer.measurement.service.error;

/**
 * Base exception for measurement ingestion, query and storage failures.
 *
 * Carries a machine-readable error code that is reported to clients.
 */
public class MeasurementException extends RuntimeException {

    private final String errorCode;

    public MeasurementException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public MeasurementException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Additional detail for the client, or null.
     */
    public String getDetails() {
        return null;
    }
}
