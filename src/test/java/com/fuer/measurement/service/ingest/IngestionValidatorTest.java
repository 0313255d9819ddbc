package com.fuer.measurement.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fuer.measurement.service.error.KindNotEnabledException;
import com.fuer.measurement.service.error.MalformedPayloadException;
import com.fuer.measurement.service.error.OutOfRangeException;
import com.fuer.measurement.service.kind.EnabledKinds;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.MeasurementTypeRegistry;
import com.fuer.measurement.service.kind.RangeValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionValidatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00.123456789Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private IngestionValidator validator;

    @BeforeEach
    void setUp() {
        var registry = new MeasurementTypeRegistry(EnabledKinds.of(MeasurementKind.POWER, MeasurementKind.FLOW));
        registry.register(MeasurementKind.POWER,
                new RangeValidator(MeasurementKind.POWER, MeasurementKind.POWER.getDefaultRange()));
        registry.register(MeasurementKind.FLOW,
                new RangeValidator(MeasurementKind.FLOW, MeasurementKind.FLOW.getDefaultRange()));
        validator = new IngestionValidator(registry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== Single Readings ====================

    @Test
    void validate_fullPayload_isNormalized() throws Exception {
        var reading = validator.validate("power", json("""
                {"value": 42.0, "timestamp": "2024-01-01T01:00:00.1234567+01:00", "source": "  meter-7 "}"""));

        assertThat(reading.kind()).isEqualTo(MeasurementKind.POWER);
        assertThat(reading.value()).isEqualTo(42.0);
        assertThat(reading.timestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00.123456Z"));
        assertThat(reading.source()).isEqualTo("meter-7");
    }

    @Test
    void validate_missingTimestamp_defaultsToNow() throws Exception {
        var reading = validator.validate("flow", json("{\"value\": 3}"));

        assertThat(reading.timestamp()).isEqualTo(Instant.parse("2024-06-01T12:00:00.123456Z"));
        assertThat(reading.source()).isNull();
    }

    @Test
    void validate_disabledKind_winsOverMalformedPayload() throws Exception {
        assertThatThrownBy(() -> validator.validate("temperature", json("{\"value\": \"hot\"}")))
                .isInstanceOf(KindNotEnabledException.class);
        assertThatThrownBy(() -> validator.validate("voltage", json("{}")))
                .isInstanceOf(KindNotEnabledException.class);
    }

    @Test
    void validate_malformedFieldsAreRejected() {
        assertMalformed("{}", "value is required");
        assertMalformed("{\"value\": null}", "value is required");
        assertMalformed("{\"value\": \"42\"}", "value must be a number");
        assertMalformed("{\"value\": 1, \"timestamp\": \"2024-01-01T00:00:00\"}", "ISO-8601");
        assertMalformed("{\"value\": 1, \"timestamp\": 1704067200}", "ISO-8601");
        assertMalformed("{\"value\": 1, \"source\": 12}", "'source' must be a string");
        assertMalformed("[1, 2]", "must be a JSON object");
    }

    @Test
    void validate_overlongSource_isRejected() throws Exception {
        var source = "s".repeat(IngestionValidator.MAX_SOURCE_LENGTH + 1);
        var payload = objectMapper.createObjectNode().put("value", 1.0).put("source", source);

        assertThatThrownBy(() -> validator.validate("power", payload))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void validate_blankSource_isStoredAsAbsent() throws Exception {
        var reading = validator.validate("power", json("{\"value\": 1, \"source\": \"   \"}"));

        assertThat(reading.source()).isNull();
    }

    @Test
    void validate_outOfRange_reportsViolatedBound() throws Exception {
        assertThatThrownBy(() -> validator.validate("power", json("{\"value\": -5}")))
                .isInstanceOf(OutOfRangeException.class)
                .hasMessageContaining("min=0.0");
    }

    @Test
    void readKind_requiresTextualKind() throws Exception {
        assertThat(validator.readKind(json("{\"kind\": \"power\", \"value\": 1}"))).isEqualTo("power");

        assertThatThrownBy(() -> validator.readKind(json("{\"value\": 1}")))
                .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> validator.readKind(json("{\"kind\": 5}")))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void validate_timestampOutsideStorableRange_isRejected() throws Exception {
        assertMalformed("{\"value\": 1, \"timestamp\": \"+300000-01-01T00:00:00Z\"}", "outside");
        assertMalformed("{\"value\": 1, \"timestamp\": \"-5000-01-01T00:00:00Z\"}", "outside");

        var latest = validator.validate("power", json("""
                {"value": 1, "timestamp": "+294276-12-31T23:59:59Z"}"""));
        assertThat(latest.timestamp()).isEqualTo(Instant.parse("+294276-12-31T23:59:59Z"));
    }

    // ==================== Batch Entries ====================

    @Test
    void validateBatchEntry_readsEpochSeconds() throws Exception {
        var reading = validator.validateBatchEntry(MeasurementKind.POWER,
                json("{\"time\": 1704067200, \"value\": 10.5}"), 0);

        assertThat(reading.timestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(reading.value()).isEqualTo(10.5);
        assertThat(reading.source()).isNull();
    }

    @Test
    void validateBatchEntry_nonIntegralTime_isRejected() throws Exception {
        assertThatThrownBy(() -> validator.validateBatchEntry(MeasurementKind.POWER,
                json("{\"time\": \"abc\", \"value\": 1}"), 3))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("Entry 3")
                .hasMessageContaining("should be int");
        assertThatThrownBy(() -> validator.validateBatchEntry(MeasurementKind.POWER,
                json("{\"time\": 1.5, \"value\": 1}"), 0))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void validateBatchEntry_timeOutsideStorableRange_isRejected() {
        assertThatThrownBy(() -> validator.validateBatchEntry(MeasurementKind.POWER,
                json("{\"time\": 9223372036854775807, \"value\": 1}"), 2))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("Entry 2")
                .hasMessageContaining("unsupported 'time'");
        assertThatThrownBy(() -> validator.validateBatchEntry(MeasurementKind.POWER,
                json("{\"time\": 9404548800000, \"value\": 1}"), 0))
                .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> validator.validateBatchEntry(MeasurementKind.POWER,
                json("{\"time\": -300000000000, \"value\": 1}"), 0))
                .isInstanceOf(MalformedPayloadException.class);
    }

    // ==================== Helpers ====================

    private void assertMalformed(String payload, String expectedMessage) {
        assertThatThrownBy(() -> validator.validate("power", json(payload)))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining(expectedMessage);
    }

    private JsonNode json(String content) throws Exception {
        return objectMapper.readTree(content);
    }
}
