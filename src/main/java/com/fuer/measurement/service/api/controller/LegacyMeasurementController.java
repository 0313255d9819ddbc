package com.fuer.measurement.service.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fuer.measurement.service.api.dto.LegacyErrorResponse;
import com.fuer.measurement.service.api.dto.LegacyMeasurementPoint;
import com.fuer.measurement.service.ingest.MeasurementIngestService;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.MeasurementTypeRegistry;
import com.fuer.measurement.service.model.StoredRecord;
import com.fuer.measurement.service.model.TimestampLimits;
import com.fuer.measurement.service.query.MeasurementQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Batch API with epoch-second timestamps.
 *
 * Handles POST /api/v1/measurements/{kind} for batches of one kind and
 * GET /api/v1/measurements for several kinds at once. Errors are reported as
 * {@code {"error": "..."}}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/measurements")
@Tag(name = "Batch Measurements (v1)", description = "Batch ingestion and multi-kind queries with epoch-second times")
@RequiredArgsConstructor
public class LegacyMeasurementController {

    static final String INVALID_BODY = "Invalid JSON or missing 'values' field.";
    static final String INVALID_TIMES = "Invalid 'from_time' or 'to_time'.";
    static final String FROM_NOT_BEFORE_TO = "'from_time' has to be smaller than 'to_time'.";
    static final String NO_MEASUREMENT = "At least one 'measurement' must be provided.";

    private final MeasurementIngestService ingestService;
    private final MeasurementQueryService queryService;
    private final MeasurementTypeRegistry registry;
    private final ObjectMapper objectMapper;

    /**
     * Ingests a batch {@code {"values": [{"time": epoch seconds, "value": number}, ...]}}.
     *
     * @return 204 once every entry is stored
     */
    @PostMapping("/{kind}")
    @Operation(summary = "Ingest a batch of readings",
               description = "Stores all entries of the batch or none of them")
    public ResponseEntity<?> ingestBatch(@PathVariable String kind,
                                         @RequestBody(required = false) String body) {
        log.debug("Handling batch POST for kind: {}", kind);

        if (!registry.isEnabled(kind)) {
            log.warn("Invalid measurement type received: {}", kind);
            return badRequest("Unknown measurement type " + kind + ".");
        }

        var ids = ingestService.ingestBatch(kind, parseBody(body));

        log.info("Successfully inserted {} measurements for {}", ids.size(), kind);
        return ResponseEntity.noContent().build();
    }

    /**
     * Returns the readings of each requested kind in {@code [from_time, to_time]}.
     */
    @GetMapping
    @Operation(summary = "Query several kinds",
               description = "Returns [{kind: [{time, value}, ...]}, ...] in the order the kinds were requested")
    public ResponseEntity<?> queryMany(
            @RequestParam(name = "measurement", required = false) List<String> measurements,
            @RequestParam(name = "from_time", required = false) String fromTime,
            @RequestParam(name = "to_time", required = false) String toTime) {

        var kinds = measurements != null ? measurements : List.<String>of();
        log.debug("GET request received for measurements: {}", kinds);

        Instant from = parseEpochSeconds(fromTime);
        Instant to = parseEpochSeconds(toTime);
        if (from == null || to == null) {
            log.warn("Invalid 'from_time' or 'to_time' received: {}, {}", fromTime, toTime);
            return badRequest(INVALID_TIMES);
        }
        if (!from.isBefore(to)) {
            log.warn("'from_time' {} is not smaller than 'to_time' {}", from, to);
            return badRequest(FROM_NOT_BEFORE_TO);
        }

        var unknown = kinds.stream().filter(kind -> !registry.isEnabled(kind)).toList();
        if (!unknown.isEmpty()) {
            log.warn("Unknown measurement types requested: {}", unknown);
            return badRequest("Unknown measurement type(s): " + formatList(unknown));
        }
        if (kinds.isEmpty()) {
            log.warn("No measurements provided in GET request");
            return badRequest(NO_MEASUREMENT);
        }

        var results = queryService.queryMany(kinds, from, to);
        return ResponseEntity.ok(toLegacyBody(results));
    }

    // --- Private helpers ---

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Error parsing JSON request body: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Instant parseEpochSeconds(String value) {
        if (value == null) {
            return null;
        }
        try {
            return TimestampLimits.fromEpochSeconds(Long.parseLong(value.trim())).orElse(null);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private List<Map<String, List<LegacyMeasurementPoint>>> toLegacyBody(
            Map<MeasurementKind, List<StoredRecord>> results) {
        return results.entrySet().stream()
                .map(entry -> Map.of(
                        entry.getKey().getToken(),
                        entry.getValue().stream().map(LegacyMeasurementPoint::from).toList()))
                .toList();
    }

    private String formatList(List<String> values) {
        return values.stream()
                .map(value -> "'" + value + "'")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private ResponseEntity<LegacyErrorResponse> badRequest(String message) {
        return ResponseEntity.badRequest().body(new LegacyErrorResponse(message));
    }
}
