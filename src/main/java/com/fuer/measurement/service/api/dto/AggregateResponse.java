package com.fuer.measurement.service.api.dto;

import com.fuer.measurement.service.model.AggregateResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate over a query window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateResponse {

    private String kind;

    /**
     * One of count, avg, min, max.
     */
    private String aggregation;

    /**
     * Window start, null when unbounded.
     */
    private Instant from;

    /**
     * Window end, null when unbounded.
     */
    private Instant to;

    /**
     * Number of readings in the window.
     */
    private long count;

    /**
     * The aggregate, null for an empty window unless the aggregation is count.
     */
    private Double value;

    private String unit;

    public static AggregateResponse from(AggregateResult result) {
        return AggregateResponse.builder()
                .kind(result.kind().getToken())
                .aggregation(result.aggregation().getParam())
                .from(result.range().from())
                .to(result.range().to())
                .count(result.count())
                .value(result.value())
                .unit(result.kind().getUnit())
                .build();
    }
}
