package com.fuer.measurement.service.error;

import java.time.Instant;

/**
 * Thrown when a query window starts after it ends.
 */
public class InvalidRangeException extends MeasurementException {

    public static final String CODE = "INVALID_RANGE";

    public InvalidRangeException(Instant from, Instant to) {
        super("'from' (%s) must not be after 'to' (%s)".formatted(from, to), CODE);
    }
}
