package com.fuer.measurement.service.persistence;

import com.fuer.measurement.service.config.MeasurementProperties;
import com.fuer.measurement.service.kind.EnabledKinds;
import com.fuer.measurement.service.kind.MeasurementKind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the measurement schema for the enabled kinds when the application starts.
 *
 * A failure here aborts startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeasurementSchemaInitializer {

    private final NamedParameterJdbcTemplate jdbc;
    private final MeasurementSqlBuilder sqlBuilder;
    private final EnabledKinds enabledKinds;
    private final MeasurementProperties properties;

    @PostConstruct
    void initialize() {
        log.info("Initializing measurement schema for kinds: {}", enabledKinds);
        if (properties.getStorage().isResetOnStartup()) {
            dropTables();
        }
        createTables();
    }

    private void dropTables() {
        log.info("Dropping measurement tables of enabled kinds and '{}'", MeasurementSqlBuilder.TYPE_TABLE);
        for (MeasurementKind kind : enabledKinds.asSet()) {
            execute(sqlBuilder.dropMeasurementTable(kind));
        }
        execute(sqlBuilder.dropTypeTable());
    }

    private void createTables() {
        execute(sqlBuilder.createTypeTable());
        for (MeasurementKind kind : enabledKinds.asSet()) {
            jdbc.update(sqlBuilder.registerType(), new MapSqlParameterSource("name", kind.getToken()));
            sqlBuilder.schemaStatements(kind).forEach(this::execute);
            log.debug("Table '{}' ready for kind '{}'", sqlBuilder.tableName(kind), kind);
        }
        log.info("Measurement schema ready for {} kinds", enabledKinds.size());
    }

    private void execute(String sql) {
        jdbc.getJdbcTemplate().execute(sql);
    }
}
