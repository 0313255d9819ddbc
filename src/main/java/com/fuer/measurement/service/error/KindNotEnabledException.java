package com.fuer.measurement.service.error;

/**
 * Thrown when a request names a kind this instance was not started with.
 */
public class KindNotEnabledException extends MeasurementException {

    public static final String CODE = "KIND_NOT_ENABLED";

    private final String kind;

    public KindNotEnabledException(String kind) {
        super("Measurement kind not enabled: " + kind, CODE);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
