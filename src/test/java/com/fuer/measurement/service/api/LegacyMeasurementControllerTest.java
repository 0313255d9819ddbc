package com.fuer.measurement.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fuer.measurement.service.api.advice.GlobalExceptionHandler;
import com.fuer.measurement.service.api.advice.LegacyExceptionHandler;
import com.fuer.measurement.service.api.controller.LegacyMeasurementController;
import com.fuer.measurement.service.config.MetricsConfig;
import com.fuer.measurement.service.error.StorageUnavailableException;
import com.fuer.measurement.service.ingest.IngestionValidator;
import com.fuer.measurement.service.ingest.MeasurementIngestService;
import com.fuer.measurement.service.kind.EnabledKinds;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.MeasurementTypeRegistry;
import com.fuer.measurement.service.kind.RangeValidator;
import com.fuer.measurement.service.model.Reading;
import com.fuer.measurement.service.model.StoredRecord;
import com.fuer.measurement.service.model.TimeRange;
import com.fuer.measurement.service.persistence.MeasurementStore;
import com.fuer.measurement.service.query.MeasurementQueryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Batch API behaviour with the store mocked out, for an instance started with {@code flow pressure}.
 */
@ExtendWith(MockitoExtension.class)
class LegacyMeasurementControllerTest {

    private static final String BATCH = """
            {"values": [{"time": 1632872334, "value": 23.5}, {"time": 1632872340, "value": 24.2}]}""";

    @Mock
    private MeasurementStore store;

    @Captor
    private ArgumentCaptor<List<Reading>> batchCaptor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var registry = new MeasurementTypeRegistry(EnabledKinds.of(MeasurementKind.FLOW, MeasurementKind.PRESSURE));
        for (MeasurementKind kind : registry.getEnabledKinds().asSet()) {
            registry.register(kind, new RangeValidator(kind, kind.getDefaultRange()));
        }
        var metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        var ingestService = new MeasurementIngestService(
                new IngestionValidator(registry, Clock.systemUTC()), registry, store, metricsConfig);
        var queryService = new MeasurementQueryService(registry, store, metricsConfig);

        mockMvc = MockMvcBuilders.standaloneSetup(
                        new LegacyMeasurementController(ingestService, queryService, registry, new ObjectMapper()))
                .setControllerAdvice(new LegacyExceptionHandler(), new GlobalExceptionHandler())
                .build();
    }

    // ==================== GET /api/v1/measurements ====================

    @Test
    void getMeasurements_returnsOneEntryPerKind() throws Exception {
        var range = new TimeRange(Instant.ofEpochSecond(0), Instant.ofEpochSecond(1000));
        when(store.query(MeasurementKind.FLOW, range)).thenReturn(List.of(record(MeasurementKind.FLOW, 100, 23.5)));
        when(store.query(MeasurementKind.PRESSURE, range)).thenReturn(List.of(record(MeasurementKind.PRESSURE, 500, 25.3)));

        mockMvc.perform(get("/api/v1/measurements")
                        .param("measurement", "flow", "pressure")
                        .param("from_time", "0")
                        .param("to_time", "1000"))
                .andExpect(status().isOk())
                .andExpect(content().json("""
                        [{"flow": [{"time": 100, "value": 23.5}]}, {"pressure": [{"time": 500, "value": 25.3}]}]""", true));
    }

    @Test
    void getMeasurements_emptyResults() throws Exception {
        mockMvc.perform(get("/api/v1/measurements")
                        .param("measurement", "flow", "pressure")
                        .param("from_time", "10000")
                        .param("to_time", "50000"))
                .andExpect(status().isOk())
                .andExpect(content().json("[{\"flow\": []}, {\"pressure\": []}]", true));
    }

    @Test
    void getMeasurements_fromNotBeforeTo() throws Exception {
        expectGetError("1000", "0", "{\"error\": \"'from_time' has to be smaller than 'to_time'.\"}");
        expectGetError("500", "500", "{\"error\": \"'from_time' has to be smaller than 'to_time'.\"}");
    }

    @Test
    void getMeasurements_invalidOrMissingTimes() throws Exception {
        var expected = "{\"error\": \"Invalid 'from_time' or 'to_time'.\"}";
        expectGetError("a", "0", expected);
        expectGetError("0", "a", expected);
        expectGetError(null, null, expected);
        expectGetError("0", null, expected);
        expectGetError(null, "200", expected);
    }

    @Test
    void getMeasurements_timesOutsideStorableRange() throws Exception {
        var expected = "{\"error\": \"Invalid 'from_time' or 'to_time'.\"}";
        expectGetError("0", "9223372036854775807", expected);
        expectGetError("-9223372036854775808", "0", expected);
        expectGetError("0", "9404548800000", expected);

        verifyNoInteractions(store);
    }

    @Test
    void getMeasurements_unknownKind() throws Exception {
        mockMvc.perform(get("/api/v1/measurements")
                        .param("measurement", "flow", "temperature")
                        .param("from_time", "0")
                        .param("to_time", "1000"))
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"error\": \"Unknown measurement type(s): ['temperature']\"}", true));

        verifyNoInteractions(store);
    }

    @Test
    void getMeasurements_noKind() throws Exception {
        mockMvc.perform(get("/api/v1/measurements")
                        .param("from_time", "0")
                        .param("to_time", "1000"))
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"error\": \"At least one 'measurement' must be provided.\"}", true));
    }

    // ==================== POST /api/v1/measurements/{kind} ====================

    @Test
    void postMeasurements_storesBatch() throws Exception {
        postBatch("flow", BATCH).andExpect(status().isNoContent());

        verify(store).appendBatch(eq(MeasurementKind.FLOW), batchCaptor.capture());
        assertThat(batchCaptor.getValue())
                .extracting(Reading::timestamp, Reading::value)
                .containsExactly(
                        tuple(Instant.ofEpochSecond(1632872334), 23.5),
                        tuple(Instant.ofEpochSecond(1632872340), 24.2));
    }

    @Test
    void postMeasurements_extraFieldsAreIgnored() throws Exception {
        postBatch("flow", """
                {"values": [{"time": 1632872334, "value": 23.5}], "additional_field": "some value", "time": "1000", "value": 200.5}""")
                .andExpect(status().isNoContent());

        verify(store).appendBatch(eq(MeasurementKind.FLOW), batchCaptor.capture());
        assertThat(batchCaptor.getValue()).hasSize(1);
    }

    @Test
    void postMeasurements_emptyValues() throws Exception {
        postBatch("pressure", "{\"values\": []}").andExpect(status().isNoContent());
    }

    @Test
    void postMeasurements_unknownKind() throws Exception {
        postBatch("temperature", BATCH)
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"error\": \"Unknown measurement type temperature.\"}", true));

        verifyNoInteractions(store);
    }

    @Test
    void postMeasurements_missingValuesOrInvalidJson() throws Exception {
        var expected = "{\"error\": \"Invalid JSON or missing 'values' field.\"}";

        postBatch("pressure", "{}")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));
        postBatch("pressure", "This is not a valid JSON!")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));

        verifyNoInteractions(store);
    }

    @Test
    void postMeasurements_invalidEntries() throws Exception {
        var expected = "{\"error\": \"Invalid JSON or missing 'values' field.\"}";

        postBatch("pressure", "{\"values\": [{\"time\": 1632872334, \"value\": \"a\"}]}")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));
        postBatch("pressure", "{\"values\": [{\"time\": \"a\", \"value\": 50}]}")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));
        postBatch("pressure", "{\"values\": [{\"value\": 50}]}")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));
        postBatch("pressure", "{\"values\": [{\"time\": 1632872334, \"value\": -1}]}")
                .andExpect(status().isBadRequest());

        verifyNoInteractions(store);
    }

    @Test
    void postMeasurements_timeOutsideStorableRange() throws Exception {
        var expected = "{\"error\": \"Invalid JSON or missing 'values' field.\"}";

        postBatch("flow", "{\"values\": [{\"time\": 9223372036854775807, \"value\": 1.5}]}")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));
        postBatch("flow", "{\"values\": [{\"time\": 1632872334, \"value\": 1.5}, {\"time\": -9223372036854775808, \"value\": 1.5}]}")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));
        // past year 294276, representable as an Instant but not as timestamptz
        postBatch("flow", "{\"values\": [{\"time\": 9404548800000, \"value\": 1.5}]}")
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));

        verifyNoInteractions(store);
    }

    @Test
    void postMeasurements_missingKind() throws Exception {
        postBatch("", BATCH).andExpect(status().isNotFound());
    }

    @Test
    void postMeasurements_storageUnavailable() throws Exception {
        when(store.appendBatch(eq(MeasurementKind.FLOW), any())).thenThrow(
                new StorageUnavailableException("Storage unavailable, could not append batch", new RuntimeException()));

        postBatch("flow", BATCH)
                .andExpect(status().isServiceUnavailable())
                .andExpect(content().json("{\"error\": \"Storage unavailable, could not append batch\"}", true));
    }

    // ==================== Helpers ====================

    private ResultActions postBatch(String kind, String body) throws Exception {
        return mockMvc.perform(post("/api/v1/measurements/" + kind)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private void expectGetError(String from, String to, String expected) throws Exception {
        var request = get("/api/v1/measurements").param("measurement", "flow", "pressure");
        if (from != null) {
            request.param("from_time", from);
        }
        if (to != null) {
            request.param("to_time", to);
        }
        mockMvc.perform(request)
                .andExpect(status().isBadRequest())
                .andExpect(content().json(expected, true));
    }

    private StoredRecord record(MeasurementKind kind, long epochSeconds, double value) {
        var time = Instant.ofEpochSecond(epochSeconds);
        return new StoredRecord(1L, kind, value, time, null, time);
    }
}
