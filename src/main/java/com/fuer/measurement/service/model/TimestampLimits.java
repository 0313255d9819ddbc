package com.fuer.measurement.service.model;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Instants the measurement store can hold: PostgreSQL {@code timestamptz} runs from
 * 4713 BC to 294276 AD at microsecond precision.
 */
public final class TimestampLimits {

    /** 4713-01-01 BC, year -4712 in ISO numbering. */
    public static final Instant MIN = LocalDateTime.of(-4712, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);

    public static final Instant MAX = LocalDateTime.of(294276, 12, 31, 23, 59, 59, 999_999_000)
            .toInstant(ZoneOffset.UTC);

    private TimestampLimits() {
    }

    public static boolean isSupported(Instant instant) {
        return !instant.isBefore(MIN) && !instant.isAfter(MAX);
    }

    /**
     * Converts epoch seconds, if the result lies within the supported range.
     */
    public static Optional<Instant> fromEpochSeconds(long epochSeconds) {
        try {
            var instant = Instant.ofEpochSecond(epochSeconds);
            return isSupported(instant) ? Optional.of(instant) : Optional.empty();
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
