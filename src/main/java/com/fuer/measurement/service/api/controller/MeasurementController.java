package com.fuer.measurement.service.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fuer.measurement.service.api.dto.AggregateResponse;
import com.fuer.measurement.service.api.dto.ApiResponse;
import com.fuer.measurement.service.api.dto.IngestResponse;
import com.fuer.measurement.service.api.dto.MeasurementRecordResponse;
import com.fuer.measurement.service.ingest.MeasurementIngestService;
import com.fuer.measurement.service.model.Aggregation;
import com.fuer.measurement.service.model.TimestampLimits;
import com.fuer.measurement.service.query.MeasurementQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Controller for measurement ingestion and queries.
 *
 * Handles POST /measurements for single readings and GET /measurements for
 * records or aggregates of one kind.
 */
@Slf4j
@RestController
@RequestMapping("/measurements")
@Tag(name = "Measurements", description = "Ingest and query readings of the enabled measurement kinds")
@RequiredArgsConstructor
public class MeasurementController {

    private final MeasurementIngestService ingestService;
    private final MeasurementQueryService queryService;

    /**
     * Ingests one reading.
     *
     * @param payload {@code {kind, value, timestamp?, source?}}
     * @return 201 with the assigned record identity
     */
    @PostMapping
    @Operation(
            summary = "Ingest a reading",
            description = "Validates a reading of an enabled kind and stores it. The timestamp defaults to the time of receipt."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Reading stored"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Malformed, out of range or kind not enabled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Storage unavailable, safe to retry")
    })
    public ResponseEntity<ApiResponse<IngestResponse>> ingest(@RequestBody JsonNode payload) {
        log.debug("Received reading: {}", payload);

        var recordId = ingestService.ingest(payload);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(IngestResponse.from(recordId)));
    }

    /**
     * Queries the records or an aggregate of one kind.
     */
    @GetMapping
    @Operation(
            summary = "Query readings",
            description = "Returns the readings of a kind ordered by timestamp, or an aggregate over them when 'agg' is given"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Records or aggregate"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid window, aggregation or kind not enabled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Storage unavailable")
    })
    public ResponseEntity<? extends ApiResponse<?>> query(
            @Parameter(description = "Measurement kind") @RequestParam String kind,
            @Parameter(description = "Inclusive window start, ISO-8601") @RequestParam(required = false) String from,
            @Parameter(description = "Inclusive window end, ISO-8601") @RequestParam(required = false) String to,
            @Parameter(description = "count, avg, min or max") @RequestParam(name = "agg", required = false) String agg) {

        var fromInstant = parseInstant("from", from);
        var toInstant = parseInstant("to", to);
        log.debug("Query: kind={}, from={}, to={}, agg={}", kind, fromInstant, toInstant, agg);

        if (agg != null) {
            var result = queryService.aggregate(kind, fromInstant, toInstant, Aggregation.fromParam(agg));
            return ResponseEntity.ok(ApiResponse.success(AggregateResponse.from(result)));
        }

        List<MeasurementRecordResponse> records = queryService.query(kind, fromInstant, toInstant).stream()
                .map(MeasurementRecordResponse::from)
                .toList();
        log.debug("Returning {} records for '{}'", records.size(), kind);
        return ResponseEntity.ok(ApiResponse.success(records));
    }

    // --- Private helpers ---

    private Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Instant instant;
        try {
            instant = OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Invalid '%s': %s (expected ISO-8601 date-time with offset)".formatted(name, value), e);
        }
        if (!TimestampLimits.isSupported(instant)) {
            throw new IllegalArgumentException("Invalid '%s': %s (outside %s..%s)".formatted(
                    name, value, TimestampLimits.MIN, TimestampLimits.MAX));
        }
        return instant;
    }
}
