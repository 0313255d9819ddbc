package com.fuer.measurement.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fuer.measurement.service.model.StoredRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A stored reading as returned by the query endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MeasurementRecordResponse {

    private long id;

    private String kind;

    private double value;

    private String unit;

    private Instant timestamp;

    /**
     * Originating device or sensor, omitted when unknown.
     */
    private String source;

    private Instant insertedAt;

    public static MeasurementRecordResponse from(StoredRecord record) {
        return MeasurementRecordResponse.builder()
                .id(record.id())
                .kind(record.kind().getToken())
                .value(record.value())
                .unit(record.kind().getUnit())
                .timestamp(record.timestamp())
                .source(record.source())
                .insertedAt(record.insertedAt())
                .build();
    }
}
