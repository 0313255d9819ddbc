package com.fuer.measurement.service.api.dto;

import com.fuer.measurement.service.model.StoredRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored reading in the v1 batch API, with its time in epoch seconds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LegacyMeasurementPoint {

    private long time;

    private double value;

    public static LegacyMeasurementPoint from(StoredRecord record) {
        return new LegacyMeasurementPoint(record.timestamp().getEpochSecond(), record.value());
    }
}
