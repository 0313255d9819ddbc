package com.fuer.measurement.service.kind;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog of measurement kinds this service knows how to validate and store.
 *
 * Each kind carries its token (as used on the command line, in request bodies and in
 * table names), its unit and the default accepted value range.
 */
public enum MeasurementKind {

    POWER("power", "W", ValueRange.atLeast(0.0)),
    FLOW("flow", "m3/h", ValueRange.atLeast(0.0)),
    TEMPERATURE("temperature", "°C", ValueRange.between(-273.15, 1000.0)),
    PRESSURE("pressure", "bar", ValueRange.between(0.0, 10000.0));

    private final String token;
    private final String unit;
    private final ValueRange defaultRange;

    MeasurementKind(String token, String unit, ValueRange defaultRange) {
        this.token = token;
        this.unit = unit;
        this.defaultRange = defaultRange;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    public String getUnit() {
        return unit;
    }

    public ValueRange getDefaultRange() {
        return defaultRange;
    }

    /**
     * Looks up a kind by its token, ignoring case and surrounding whitespace.
     *
     * @param token the kind token, may be null
     * @return the kind if the token names a supported one
     */
    public static Optional<MeasurementKind> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        var normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.token.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return token;
    }
}
