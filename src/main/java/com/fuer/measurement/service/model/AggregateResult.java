package com.fuer.measurement.service.model;

import com.fuer.measurement.service.kind.MeasurementKind;

/**
 * Result of aggregating the readings of one kind over a window.
 *
 * @param kind        the measurement kind
 * @param aggregation the applied aggregation
 * @param range       the queried window
 * @param count       number of readings in the window
 * @param value       the aggregate; null for an empty window unless the aggregation is COUNT
 */
public record AggregateResult(
        MeasurementKind kind,
        Aggregation aggregation,
        TimeRange range,
        long count,
        Double value
) {}
