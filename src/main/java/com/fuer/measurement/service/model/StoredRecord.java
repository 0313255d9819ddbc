package com.fuer.measurement.service.model;

import com.fuer.measurement.service.kind.MeasurementKind;

import java.time.Instant;

/**
 * A persisted reading. Immutable once written.
 *
 * @param id         identity assigned by the store, increasing per kind in insertion order
 * @param kind       the measurement kind
 * @param value      the measured value
 * @param timestamp  when the value was measured
 * @param source     originating device or sensor, may be null
 * @param insertedAt when the record was written
 */
public record StoredRecord(
        long id,
        MeasurementKind kind,
        double value,
        Instant timestamp,
        String source,
        Instant insertedAt
) {
    public RecordId recordId() {
        return new RecordId(kind, id);
    }
}
