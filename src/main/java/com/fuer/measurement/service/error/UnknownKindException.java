package com.fuer.measurement.service.error;

/**
 * Thrown when a kind token does not name a supported measurement kind.
 *
 * Raised while the enabled kinds are read from the startup arguments, where it aborts startup.
 */
public class UnknownKindException extends MeasurementException {

    public static final String CODE = "UNKNOWN_KIND";

    private final String kind;

    public UnknownKindException(String kind) {
        super("Unknown measurement kind: " + kind, CODE);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
