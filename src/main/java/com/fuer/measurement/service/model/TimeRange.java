package com.fuer.measurement.service.model;

import com.fuer.measurement.service.error.InvalidRangeException;

import java.time.Instant;

/**
 * Inclusive time window. A null bound leaves that side open.
 */
public record TimeRange(Instant from, Instant to) {

    private static final TimeRange UNBOUNDED = new TimeRange(null, null);

    public TimeRange {
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidRangeException(from, to);
        }
    }

    public static TimeRange of(Instant from, Instant to) {
        return from == null && to == null ? UNBOUNDED : new TimeRange(from, to);
    }

    public static TimeRange unbounded() {
        return UNBOUNDED;
    }
}
