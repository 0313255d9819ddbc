package com.fuer.measurement.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fuer.measurement.service.error.MalformedPayloadException;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.MeasurementTypeRegistry;
import com.fuer.measurement.service.model.Reading;
import com.fuer.measurement.service.model.TimestampLimits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Turns raw JSON payloads into validated, normalized readings.
 *
 * Checks run in a fixed order: the kind must be enabled, then the fields must be
 * well-typed, then the kind's validator checks the value. Timestamps are kept at
 * microsecond precision.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionValidator {

    static final int MAX_SOURCE_LENGTH = 255;

    private final MeasurementTypeRegistry registry;
    private final Clock clock;

    // ==================== Public API ====================

    /**
     * Validates a reading payload of the form
     * {@code {"value": number, "timestamp"?: ISO-8601 string, "source"?: string}}.
     *
     * @param kind the kind token
     * @param rawPayload the JSON payload
     * @return the normalized reading
     * @throws com.fuer.measurement.service.error.KindNotEnabledException if the kind is not enabled
     * @throws MalformedPayloadException if a field is missing or of the wrong type
     * @throws com.fuer.measurement.service.error.OutOfRangeException if the value violates a bound
     */
    public Reading validate(String kind, JsonNode rawPayload) {
        var measurementKind = registry.requireEnabled(kind);
        requireObject(rawPayload, "Reading");

        var reading = new Reading(
                measurementKind,
                readValue(rawPayload.get("value"), "value"),
                readTimestamp(rawPayload.get("timestamp")),
                readSource(rawPayload.get("source"))
        );
        return applyKindValidator(reading);
    }

    /**
     * Validates one entry of a batch, {@code {"time": epoch seconds, "value": number}}.
     *
     * @param kind an enabled kind
     * @param entry the entry
     * @param index position of the entry in the batch, used in error messages
     * @return the normalized reading
     */
    public Reading validateBatchEntry(MeasurementKind kind, JsonNode entry, int index) {
        requireObject(entry, "Entry " + index);

        var time = entry.get("time");
        if (time == null || !time.isIntegralNumber() || !time.canConvertToLong()) {
            throw new MalformedPayloadException(
                    "Entry %d has invalid 'time': %s (should be int)".formatted(index, time));
        }
        var timestamp = TimestampLimits.fromEpochSeconds(time.longValue())
                .orElseThrow(() -> new MalformedPayloadException(
                        "Entry %d has unsupported 'time': %s (outside %s..%s)".formatted(
                                index, time, TimestampLimits.MIN, TimestampLimits.MAX)));
        var reading = new Reading(
                kind,
                readValue(entry.get("value"), "Entry " + index + " 'value'"),
                timestamp,
                null
        );
        return applyKindValidator(reading);
    }

    /**
     * Extracts the kind token from an ingest payload.
     */
    public String readKind(JsonNode rawPayload) {
        requireObject(rawPayload, "Reading");
        var kind = rawPayload.get("kind");
        if (kind == null || !kind.isTextual() || kind.asText().isBlank()) {
            throw new MalformedPayloadException("'kind' is required and must be a string");
        }
        return kind.asText();
    }

    // ==================== Field Readers ====================

    private double readValue(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            throw new MalformedPayloadException(field + " is required");
        }
        if (!node.isNumber()) {
            throw new MalformedPayloadException(
                    "%s must be a number, got %s".formatted(field, node.getNodeType()));
        }
        double value = node.doubleValue();
        if (!Double.isFinite(value)) {
            throw new MalformedPayloadException(field + " must be a finite number");
        }
        return value;
    }

    private Instant readTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return now();
        }
        if (!node.isTextual()) {
            throw new MalformedPayloadException("'timestamp' must be an ISO-8601 string");
        }
        Instant timestamp;
        try {
            timestamp = OffsetDateTime.parse(node.asText()).toInstant().truncatedTo(ChronoUnit.MICROS);
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException(
                    "'timestamp' is not an ISO-8601 date-time with offset: " + node.asText(), e);
        }
        if (!TimestampLimits.isSupported(timestamp)) {
            throw new MalformedPayloadException("'timestamp' %s is outside %s..%s".formatted(
                    node.asText(), TimestampLimits.MIN, TimestampLimits.MAX));
        }
        return timestamp;
    }

    private String readSource(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedPayloadException("'source' must be a string");
        }
        var source = node.asText().trim();
        if (source.length() > MAX_SOURCE_LENGTH) {
            throw new MalformedPayloadException(
                    "'source' must be at most " + MAX_SOURCE_LENGTH + " characters");
        }
        return source.isEmpty() ? null : source;
    }

    // ==================== Helpers ====================

    private void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new MalformedPayloadException(what + " must be a JSON object");
        }
    }

    private Reading applyKindValidator(Reading reading) {
        var normalized = registry.resolve(reading.kind()).validate(reading);
        log.debug("Validated {} reading: value={}, timestamp={}",
                normalized.kind(), normalized.value(), normalized.timestamp());
        return normalized;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
