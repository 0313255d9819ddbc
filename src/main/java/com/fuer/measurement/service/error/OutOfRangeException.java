package com.fuer.measurement.service.error;

import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.ValueRange;

/**
 * Thrown when a reading's value falls outside the accepted range of its kind.
 */
public class OutOfRangeException extends MeasurementException {

    public static final String CODE = "OUT_OF_RANGE";

    private final MeasurementKind kind;
    private final double value;
    private final ValueRange.Bound bound;

    public OutOfRangeException(MeasurementKind kind, double value, ValueRange.Bound bound) {
        super("Value %s is out of range for %s (%s)".formatted(value, kind, bound), CODE);
        this.kind = kind;
        this.value = value;
        this.bound = bound;
    }

    public MeasurementKind getKind() {
        return kind;
    }

    public double getValue() {
        return value;
    }

    public ValueRange.Bound getBound() {
        return bound;
    }

    @Override
    public String getDetails() {
        return bound.toString();
    }
}
