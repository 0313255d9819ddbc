package com.fuer.measurement.service.query;

import com.fuer.measurement.service.config.MetricsConfig;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.MeasurementTypeRegistry;
import com.fuer.measurement.service.model.AggregateResult;
import com.fuer.measurement.service.model.Aggregation;
import com.fuer.measurement.service.model.StoredRecord;
import com.fuer.measurement.service.model.TimeRange;
import com.fuer.measurement.service.persistence.MeasurementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read path over the measurement store.
 *
 * Every query checks that the kind is enabled before the window, so a disabled kind is
 * reported the same way here as on ingestion. Nothing on this path writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeasurementQueryService {

    private final MeasurementTypeRegistry registry;
    private final MeasurementStore store;
    private final MetricsConfig metricsConfig;

    /**
     * Returns the records of a kind in {@code [from, to]}, oldest first.
     *
     * @param kind the kind token
     * @param from inclusive lower bound, null for unbounded
     * @param to inclusive upper bound, null for unbounded
     * @throws com.fuer.measurement.service.error.KindNotEnabledException if the kind is not enabled
     * @throws com.fuer.measurement.service.error.InvalidRangeException if from is after to
     */
    public List<StoredRecord> query(String kind, Instant from, Instant to) {
        var measurementKind = registry.requireEnabled(kind);
        var range = TimeRange.of(from, to);
        return metricsConfig.getQueryTimer().record(() -> store.query(measurementKind, range));
    }

    /**
     * Aggregates the values of a kind in {@code [from, to]}.
     *
     * @throws com.fuer.measurement.service.error.KindNotEnabledException if the kind is not enabled
     * @throws com.fuer.measurement.service.error.InvalidRangeException if from is after to
     */
    public AggregateResult aggregate(String kind, Instant from, Instant to, Aggregation aggregation) {
        var measurementKind = registry.requireEnabled(kind);
        var range = TimeRange.of(from, to);
        var result = metricsConfig.getQueryTimer().record(
                () -> store.aggregate(measurementKind, range, aggregation));
        log.debug("Aggregated {} over {} readings of '{}': {}",
                aggregation, result.count(), measurementKind, result.value());
        return result;
    }

    /**
     * Returns, per requested kind, its records in {@code [from, to]}. All kinds are checked
     * before any is read.
     *
     * @param kinds kind tokens, at least one
     * @return records keyed by kind, in request order
     */
    public Map<MeasurementKind, List<StoredRecord>> queryMany(List<String> kinds, Instant from, Instant to) {
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("At least one measurement kind must be requested");
        }
        var measurementKinds = kinds.stream().map(registry::requireEnabled).distinct().toList();
        var range = TimeRange.of(from, to);

        var results = new LinkedHashMap<MeasurementKind, List<StoredRecord>>();
        metricsConfig.getQueryTimer().record(() ->
                measurementKinds.forEach(kind -> results.put(kind, store.query(kind, range))));
        log.info("Fetched measurements for {} between {} and {}", measurementKinds, from, to);
        return results;
    }
}
