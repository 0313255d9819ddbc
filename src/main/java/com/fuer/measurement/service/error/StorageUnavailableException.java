package com.fuer.measurement.service.error;

/**
 * Thrown when the measurement store cannot complete an operation.
 *
 * Nothing is written when an append fails with this exception; clients may retry.
 */
public class StorageUnavailableException extends MeasurementException {

    public static final String CODE = "STORAGE_UNAVAILABLE";

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
