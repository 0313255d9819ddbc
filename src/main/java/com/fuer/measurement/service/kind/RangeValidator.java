package com.fuer.measurement.service.kind;

import com.fuer.measurement.service.error.OutOfRangeException;
import com.fuer.measurement.service.model.Reading;

/**
 * Accepts values inside an inclusive range.
 */
public class RangeValidator implements MeasurementValidator {

    private final MeasurementKind kind;
    private final ValueRange range;

    public RangeValidator(MeasurementKind kind, ValueRange range) {
        this.kind = kind;
        this.range = range;
    }

    @Override
    public Reading validate(Reading reading) {
        double value = reading.value();
        range.violatedBy(value).ifPresent(bound -> {
            throw new OutOfRangeException(kind, value, bound);
        });
        // -0.0 is stored as 0.0
        return value == 0.0 ? reading.withValue(0.0) : reading;
    }

    public ValueRange getRange() {
        return range;
    }
}
