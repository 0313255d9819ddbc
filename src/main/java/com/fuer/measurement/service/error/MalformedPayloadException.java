package com.fuer.measurement.service.error;

/**
 * Thrown when a reading is missing required fields or has fields of the wrong type.
 */
public class MalformedPayloadException extends MeasurementException {

    public static final String CODE = "MALFORMED_PAYLOAD";

    public MalformedPayloadException(String message) {
        super(message, CODE);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
