package com.fuer.measurement.service.api.dto;

import com.fuer.measurement.service.model.RecordId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity assigned to an ingested reading.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

    private String kind;

    private long id;

    public static IngestResponse from(RecordId recordId) {
        return new IngestResponse(recordId.kind().getToken(), recordId.id());
    }
}
