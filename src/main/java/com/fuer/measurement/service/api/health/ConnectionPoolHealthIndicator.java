package com.fuer.measurement.service.api.health;

import com.fuer.measurement.service.config.MeasurementProperties;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the storage connection pool.
 *
 * Reports pool usage and the number of requests waiting for a connection. A fully used pool is
 * still UP; the pool is DOWN once too many requests queue behind it.
 */
@Component
@RequiredArgsConstructor
public class ConnectionPoolHealthIndicator implements HealthIndicator {

    private final HikariDataSource dataSource;
    private final MeasurementProperties properties;

    @Override
    public Health health() {
        var pool = dataSource.getHikariPoolMXBean();
        if (pool == null) {
            return Health.unknown()
                    .withDetail("poolName", String.valueOf(dataSource.getPoolName()))
                    .build();
        }

        int active = pool.getActiveConnections();
        int maxPoolSize = dataSource.getMaximumPoolSize();
        int utilization = maxPoolSize > 0 ? active * 100 / maxPoolSize : 0;
        int waiting = pool.getThreadsAwaitingConnection();
        int maxWaiting = properties.getPool().getHealthMaxWaitingThreads();

        Health.Builder builder = waiting >= maxWaiting
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("poolName", dataSource.getPoolName())
                .withDetail("activeConnections", active)
                .withDetail("idleConnections", pool.getIdleConnections())
                .withDetail("totalConnections", pool.getTotalConnections())
                .withDetail("maxPoolSize", maxPoolSize)
                .withDetail("threadsAwaitingConnection", waiting)
                .withDetail("utilizationPercent", utilization)
                .withDetail("maxWaitingThreads", maxWaiting)
                .build();
    }
}
