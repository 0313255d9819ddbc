package com.fuer.measurement.service.persistence;

import com.fuer.measurement.service.config.MetricsConfig;
import com.fuer.measurement.service.error.StorageUnavailableException;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.model.AggregateResult;
import com.fuer.measurement.service.model.Aggregation;
import com.fuer.measurement.service.model.Reading;
import com.fuer.measurement.service.model.RecordId;
import com.fuer.measurement.service.model.StoredRecord;
import com.fuer.measurement.service.model.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * PostgreSQL implementation of MeasurementStore using Spring JDBC.
 *
 * Data access failures, including a pool that stays exhausted past its connection
 * timeout, surface as StorageUnavailableException.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcMeasurementStore implements MeasurementStore {

    private static final String[] ID_COLUMN = {"id"};

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final MeasurementSqlBuilder sqlBuilder;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // ==================== MeasurementStore Interface ====================

    @Override
    public RecordId append(Reading reading) {
        return withStorage("append " + reading.kind() + " reading", () -> insert(reading));
    }

    @Override
    public List<RecordId> appendBatch(MeasurementKind kind, List<Reading> readings) {
        if (readings.isEmpty()) {
            return List.of();
        }
        return withStorage("append batch of " + readings.size() + " " + kind + " readings",
                () -> transactionTemplate.execute(status -> insertAll(kind, readings)));
    }

    @Override
    public List<StoredRecord> query(MeasurementKind kind, TimeRange range) {
        return withStorage("query " + kind + " readings", () -> {
            var records = jdbc.query(sqlBuilder.selectRange(kind, range), rangeParams(range), recordMapper(kind));
            log.debug("Fetched {} rows for '{}' in {}", records.size(), kind, range);
            return records;
        });
    }

    @Override
    public AggregateResult aggregate(MeasurementKind kind, TimeRange range, Aggregation aggregation) {
        return withStorage("aggregate " + kind + " readings", () -> jdbc.queryForObject(
                sqlBuilder.aggregate(kind, range, aggregation),
                rangeParams(range),
                (rs, rowNum) -> toAggregate(rs, kind, range, aggregation)));
    }

    @Override
    public long count(MeasurementKind kind) {
        return withStorage("count " + kind + " readings", () -> {
            Long count = jdbc.getJdbcTemplate().queryForObject(sqlBuilder.count(kind), Long.class);
            return count != null ? count : 0L;
        });
    }

    // ==================== Writes ====================

    private List<RecordId> insertAll(MeasurementKind kind, List<Reading> readings) {
        var ids = new ArrayList<RecordId>(readings.size());
        for (Reading reading : readings) {
            if (reading.kind() != kind) {
                throw new IllegalArgumentException(
                        "Batch for '%s' contains a '%s' reading".formatted(kind, reading.kind()));
            }
            ids.add(insert(reading));
        }
        log.info("Inserted {} measurements for '{}'", ids.size(), kind);
        return ids;
    }

    private RecordId insert(Reading reading) {
        var keyHolder = new GeneratedKeyHolder();
        var params = new MapSqlParameterSource()
                .addValue("measured_at", toUtc(reading.timestamp()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("measured_value", reading.value(), Types.DOUBLE)
                .addValue("source", reading.source(), Types.VARCHAR)
                .addValue("inserted_at", toUtc(now()), Types.TIMESTAMP_WITH_TIMEZONE);

        jdbc.update(sqlBuilder.insert(reading.kind()), params, keyHolder, ID_COLUMN);

        var key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for " + reading.kind() + " reading");
        }
        var id = new RecordId(reading.kind(), key.longValue());
        log.debug("Stored reading {}", id);
        return id;
    }

    // ==================== Mapping ====================

    private RowMapper<StoredRecord> recordMapper(MeasurementKind kind) {
        return (rs, rowNum) -> new StoredRecord(
                rs.getLong("id"),
                kind,
                rs.getDouble("measured_value"),
                readInstant(rs, "measured_at"),
                rs.getString("source"),
                readInstant(rs, "inserted_at")
        );
    }

    private AggregateResult toAggregate(ResultSet rs, MeasurementKind kind, TimeRange range,
                                        Aggregation aggregation) throws SQLException {
        long count = rs.getLong("sample_count");
        var raw = (Number) rs.getObject("aggregate_value");
        Double value = raw != null ? raw.doubleValue() : null;
        return new AggregateResult(kind, aggregation, range, count, value);
    }

    private Instant readInstant(ResultSet rs, String column) throws SQLException {
        var value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    // ==================== Helpers ====================

    private MapSqlParameterSource rangeParams(TimeRange range) {
        var params = new MapSqlParameterSource();
        if (range.from() != null) {
            params.addValue("from", toUtc(range.from()), Types.TIMESTAMP_WITH_TIMEZONE);
        }
        if (range.to() != null) {
            params.addValue("to", toUtc(range.to()), Types.TIMESTAMP_WITH_TIMEZONE);
        }
        return params;
    }

    private OffsetDateTime toUtc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private <T> T withStorage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            metricsConfig.getStorageFailures().increment();
            log.error("Storage operation failed: {}", operation, e);
            throw new StorageUnavailableException("Storage unavailable, could not " + operation, e);
        }
    }
}
