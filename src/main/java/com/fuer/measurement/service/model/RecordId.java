package com.fuer.measurement.service.model;

import com.fuer.measurement.service.kind.MeasurementKind;

/**
 * Identity of a stored record. Ids are unique within a kind.
 */
public record RecordId(MeasurementKind kind, long id) {

    @Override
    public String toString() {
        return kind + "/" + id;
    }
}
