package com.fuer.measurement.service.persistence;

import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.model.Aggregation;
import com.fuer.measurement.service.model.TimeRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds the SQL statements for the per-kind measurement tables.
 *
 * Every enabled kind gets its own table {@code measurement_<kind>} with the same shape.
 * Statements use only syntax shared by PostgreSQL and H2 in PostgreSQL mode.
 */
@Component
public class MeasurementSqlBuilder {

    static final String TYPE_TABLE = "measurement_type";

    private static final String TABLE_PREFIX = "measurement_";
    private static final Pattern TABLE_NAME_RE = Pattern.compile("^[a-z][a-z0-9_]{0,62}$");

    // ==================== Table Names ====================

    /**
     * Table holding the readings of a kind.
     */
    public String tableName(MeasurementKind kind) {
        var name = TABLE_PREFIX + kind.getToken();
        if (!TABLE_NAME_RE.matcher(name).matches()) {
            throw new IllegalStateException("Invalid measurement table name: " + name);
        }
        return name;
    }

    // ==================== Schema ====================

    public String createTypeTable() {
        return """
                CREATE TABLE IF NOT EXISTS measurement_type (
                    id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    name VARCHAR(255) NOT NULL UNIQUE
                )""";
    }

    public String registerType() {
        return """
                INSERT INTO measurement_type (name)
                SELECT CAST(:name AS VARCHAR(255)) WHERE NOT EXISTS (SELECT 1 FROM measurement_type WHERE name = :name)""";
    }

    public String createMeasurementTable(MeasurementKind kind) {
        return """
                CREATE TABLE IF NOT EXISTS %s (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    measured_at TIMESTAMP WITH TIME ZONE NOT NULL,
                    measured_value DOUBLE PRECISION NOT NULL,
                    source VARCHAR(255),
                    inserted_at TIMESTAMP WITH TIME ZONE NOT NULL
                )""".formatted(tableName(kind));
    }

    public String createTimeIndex(MeasurementKind kind) {
        var table = tableName(kind);
        return "CREATE INDEX IF NOT EXISTS %s_measured_at ON %s (measured_at, id)".formatted(table, table);
    }

    public String dropMeasurementTable(MeasurementKind kind) {
        return "DROP TABLE IF EXISTS %s CASCADE".formatted(tableName(kind));
    }

    public String dropTypeTable() {
        return "DROP TABLE IF EXISTS measurement_type CASCADE";
    }

    // ==================== Data ====================

    public String insert(MeasurementKind kind) {
        return """
                INSERT INTO %s (measured_at, measured_value, source, inserted_at)
                VALUES (:measured_at, :measured_value, :source, :inserted_at)""".formatted(tableName(kind));
    }

    /**
     * Selects the readings in a window, oldest first, ties in insertion order.
     */
    public String selectRange(MeasurementKind kind, TimeRange range) {
        return "SELECT id, measured_at, measured_value, source, inserted_at FROM %s%s ORDER BY measured_at ASC, id ASC"
                .formatted(tableName(kind), whereClause(range));
    }

    public String aggregate(MeasurementKind kind, TimeRange range, Aggregation aggregation) {
        return "SELECT COUNT(measured_value) AS sample_count, %s(measured_value) AS aggregate_value FROM %s%s"
                .formatted(aggregation.getSqlFunction(), tableName(kind), whereClause(range));
    }

    public String count(MeasurementKind kind) {
        return "SELECT COUNT(*) FROM %s".formatted(tableName(kind));
    }

    // ==================== Helpers ====================

    private String whereClause(TimeRange range) {
        var conditions = new ArrayList<String>();
        if (range.from() != null) {
            conditions.add("measured_at >= :from");
        }
        if (range.to() != null) {
            conditions.add("measured_at <= :to");
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    List<String> schemaStatements(MeasurementKind kind) {
        return List.of(createMeasurementTable(kind), createTimeIndex(kind));
    }
}
