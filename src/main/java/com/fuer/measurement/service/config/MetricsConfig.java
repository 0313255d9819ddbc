package com.fuer.measurement.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the Measurement Service.
 *
 * Provides custom metrics for ingestion and query operations.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter readingsIngested;
    private final Counter readingsRejected;
    private final Counter storageFailures;

    // Timers
    private final Timer ingestionTimer;
    private final Timer queryTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.readingsIngested = Counter.builder("measurements.ingest.count")
                .description("Number of readings stored")
                .register(registry);

        this.readingsRejected = Counter.builder("measurements.ingest.rejected")
                .description("Number of readings rejected by validation")
                .register(registry);

        this.storageFailures = Counter.builder("measurements.storage.failures")
                .description("Number of failed storage operations")
                .register(registry);

        this.ingestionTimer = Timer.builder("measurements.ingest.duration")
                .description("Time taken to validate and store readings")
                .register(registry);

        this.queryTimer = Timer.builder("measurements.query.duration")
                .description("Time taken for measurement queries")
                .register(registry);
    }

    /**
     * Registers a gauge.
     *
     * @param name the metric name
     * @param description the metric description
     * @param valueSupplier supplier for the current value
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
                .description(description)
                .register(registry);
    }
}
