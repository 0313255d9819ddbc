package com.fuer.measurement.service.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Aggregations supported over a query window.
 */
public enum Aggregation {

    COUNT("count", "COUNT"),
    AVG("avg", "AVG"),
    MIN("min", "MIN"),
    MAX("max", "MAX");

    private final String param;
    private final String sqlFunction;

    Aggregation(String param, String sqlFunction) {
        this.param = param;
        this.sqlFunction = sqlFunction;
    }

    @JsonValue
    public String getParam() {
        return param;
    }

    public String getSqlFunction() {
        return sqlFunction;
    }

    /**
     * Parses a request parameter value.
     *
     * @throws IllegalArgumentException if the value names no supported aggregation
     */
    public static Aggregation fromParam(String value) {
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(agg -> agg.param.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported aggregation '%s', expected one of: %s".formatted(value, supported())));
    }

    private static String supported() {
        return Arrays.stream(values())
                .map(Aggregation::getParam)
                .collect(Collectors.joining(", "));
    }
}
