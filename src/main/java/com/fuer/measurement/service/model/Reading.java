package com.fuer.measurement.service.model;

import com.fuer.measurement.service.kind.MeasurementKind;

import java.time.Instant;

/**
 * One client-submitted data point, before persistence.
 *
 * @param kind      the measurement kind
 * @param value     the measured value
 * @param timestamp when the value was measured
 * @param source    originating device or sensor, may be null
 */
public record Reading(MeasurementKind kind, double value, Instant timestamp, String source) {

    public Reading withValue(double newValue) {
        return new Reading(kind, newValue, timestamp, source);
    }
}
