package com.fuer.measurement.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for measurement validation and storage.
 *
 * The enabled kinds themselves are not configured here; they come from the
 * positional startup arguments.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "measurements")
public class MeasurementProperties {

    /**
     * Per-kind overrides of the default accepted value range, keyed by kind token.
     */
    private Map<String, RangeOverride> ranges = new LinkedHashMap<>();

    /**
     * Storage settings.
     */
    private StorageConfig storage = new StorageConfig();

    /**
     * Connection pool settings.
     */
    @Valid
    private PoolConfig pool = new PoolConfig();

    @Getter
    @Setter
    public static class RangeOverride {

        /**
         * Inclusive lower bound (null keeps the default).
         */
        private Double min;

        /**
         * Inclusive upper bound (null keeps the default).
         */
        private Double max;
    }

    @Getter
    @Setter
    public static class StorageConfig {

        /**
         * Drop the measurement tables of the enabled kinds before creating them.
         */
        private boolean resetOnStartup = false;
    }

    @Getter
    @Setter
    public static class PoolConfig {

        /**
         * Connections added on top of one per enabled kind (default: 2).
         */
        @Min(0)
        private int extraConnections = 2;

        /**
         * Requests waiting for a connection at which the pool health is reported DOWN.
         */
        @Min(1)
        private int healthMaxWaitingThreads = 20;
    }
}
