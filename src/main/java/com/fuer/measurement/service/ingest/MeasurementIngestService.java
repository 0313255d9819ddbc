package com.fuer.measurement.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fuer.measurement.service.config.MetricsConfig;
import com.fuer.measurement.service.error.MalformedPayloadException;
import com.fuer.measurement.service.error.MeasurementException;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.MeasurementTypeRegistry;
import com.fuer.measurement.service.model.Reading;
import com.fuer.measurement.service.model.RecordId;
import com.fuer.measurement.service.persistence.MeasurementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Validates incoming readings and appends them to the store.
 *
 * Rejected readings are never stored. Nothing is retried server-side.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeasurementIngestService {

    private final IngestionValidator validator;
    private final MeasurementTypeRegistry registry;
    private final MeasurementStore store;
    private final MetricsConfig metricsConfig;

    /**
     * Ingests a single reading {@code {kind, value, timestamp?, source?}}.
     *
     * @return identity of the stored record
     */
    public RecordId ingest(JsonNode payload) {
        return timed(() -> {
            var reading = validated(() -> validator.validate(validator.readKind(payload), payload));
            var id = store.append(reading);
            metricsConfig.getReadingsIngested().increment();
            log.info("Stored {} reading {} (value={})", reading.kind(), id, reading.value());
            return id;
        });
    }

    /**
     * Ingests a batch {@code {"values": [{"time": epoch seconds, "value": number}, ...]}}
     * for one kind. Every entry is validated before any is stored; the batch is stored
     * all-or-nothing.
     *
     * @return identities in entry order
     */
    public List<RecordId> ingestBatch(String kind, JsonNode body) {
        return timed(() -> {
            var measurementKind = validated(() -> registry.requireEnabled(kind));
            var readings = validated(() -> validateBatch(measurementKind, body));
            var ids = store.appendBatch(measurementKind, readings);
            metricsConfig.getReadingsIngested().increment(ids.size());
            log.info("Stored {} readings for '{}'", ids.size(), kind);
            return ids;
        });
    }

    // ==================== Helpers ====================

    private List<Reading> validateBatch(MeasurementKind measurementKind, JsonNode body) {
        var values = body != null && body.isObject() ? body.get("values") : null;
        if (values == null || !values.isArray()) {
            throw new MalformedPayloadException("Invalid JSON or missing 'values' field.");
        }
        var readings = new ArrayList<Reading>(values.size());
        for (int i = 0; i < values.size(); i++) {
            readings.add(validator.validateBatchEntry(measurementKind, values.get(i), i));
        }
        return readings;
    }

    private <T> T validated(Supplier<T> validation) {
        try {
            return validation.get();
        } catch (MeasurementException e) {
            metricsConfig.getReadingsRejected().increment();
            log.warn("Rejected reading: {} [{}]", e.getMessage(), e.getErrorCode());
            throw e;
        }
    }

    private <T> T timed(Supplier<T> action) {
        return metricsConfig.getIngestionTimer().record(action);
    }
}
