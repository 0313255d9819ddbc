package com.fuer.measurement.service.persistence;

import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.model.AggregateResult;
import com.fuer.measurement.service.model.Aggregation;
import com.fuer.measurement.service.model.Reading;
import com.fuer.measurement.service.model.RecordId;
import com.fuer.measurement.service.model.StoredRecord;
import com.fuer.measurement.service.model.TimeRange;

import java.util.List;

/**
 * Append-only storage for validated readings, one table per enabled kind.
 *
 * All operations fail with {@link com.fuer.measurement.service.error.StorageUnavailableException}
 * when the backing store cannot complete them.
 */
public interface MeasurementStore {

    /**
     * Persists one reading.
     *
     * @param reading a validated reading
     * @return identity of the stored record
     */
    RecordId append(Reading reading);

    /**
     * Persists readings of one kind in a single transaction; either all are stored or none.
     *
     * @param kind the kind of every reading
     * @param readings validated readings
     * @return identities in input order
     */
    List<RecordId> appendBatch(MeasurementKind kind, List<Reading> readings);

    /**
     * Returns the records of a kind inside the window, by timestamp ascending,
     * ties in insertion order.
     */
    List<StoredRecord> query(MeasurementKind kind, TimeRange range);

    /**
     * Aggregates the values of a kind inside the window.
     */
    AggregateResult aggregate(MeasurementKind kind, TimeRange range, Aggregation aggregation);

    /**
     * Total number of records of a kind.
     */
    long count(MeasurementKind kind);
}
