package com.fuer.measurement.service.config;

import com.fuer.measurement.service.kind.EnabledKinds;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Storage configuration.
 *
 * The connection pool is sized from the enabled kinds: one idle connection per kind and
 * {@code measurements.pool.extra-connections} more at peak. Requests beyond the pool size
 * wait for a free connection up to {@code spring.datasource.hikari.connection-timeout}.
 * Explicit {@code spring.datasource.hikari.*} settings win over the derived sizes.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties dataSourceProperties,
                                       EnabledKinds enabledKinds,
                                       MeasurementProperties properties) {
        var dataSource = dataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
        int kinds = enabledKinds.size();
        dataSource.setPoolName("measurement-pool");
        dataSource.setMinimumIdle(kinds);
        dataSource.setMaximumPoolSize(kinds + properties.getPool().getExtraConnections());
        log.info("Derived connection pool size for {} kinds: min={}, max={}",
                kinds, dataSource.getMinimumIdle(), dataSource.getMaximumPoolSize());
        return dataSource;
    }

    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }
}
