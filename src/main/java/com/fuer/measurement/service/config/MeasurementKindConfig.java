package com.fuer.measurement.service.config;

import com.fuer.measurement.service.kind.EnabledKinds;
import com.fuer.measurement.service.kind.MeasurementKind;
import com.fuer.measurement.service.kind.MeasurementTypeRegistry;
import com.fuer.measurement.service.kind.RangeValidator;
import com.fuer.measurement.service.kind.ValueRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the enabled kind set from the startup arguments and populates the registry.
 *
 * An unsupported kind name aborts startup.
 */
@Slf4j
@Configuration
public class MeasurementKindConfig {

    /**
     * Enabled kinds, taken from the positional (non-option) startup arguments.
     */
    @Bean
    public EnabledKinds enabledKinds(ApplicationArguments arguments) {
        var tokens = arguments.getNonOptionArgs();
        log.debug("Parsing measurement kinds from arguments: {}", tokens);
        var enabledKinds = EnabledKinds.fromTokens(tokens);
        log.info("Measurement kinds enabled: {}", enabledKinds);
        return enabledKinds;
    }

    /**
     * Registry with one range validator per enabled kind.
     */
    @Bean
    public MeasurementTypeRegistry measurementTypeRegistry(EnabledKinds enabledKinds,
                                                           MeasurementProperties properties,
                                                           MetricsConfig metricsConfig) {
        var registry = new MeasurementTypeRegistry(enabledKinds);
        for (MeasurementKind kind : enabledKinds.asSet()) {
            var validator = new RangeValidator(kind, resolveRange(kind, properties));
            registry.register(kind, validator);
            log.info("Kind '{}' accepts values in [{}, {}] {}", kind,
                    describe(validator.getRange().min()), describe(validator.getRange().max()), kind.getUnit());
        }
        metricsConfig.registerGauge(
                "measurements.kinds.enabled",
                "Number of measurement kinds enabled at startup",
                enabledKinds::size
        );
        return registry;
    }

    // ==================== Helper Methods ====================

    private ValueRange resolveRange(MeasurementKind kind, MeasurementProperties properties) {
        var override = properties.getRanges().get(kind.getToken());
        if (override == null) {
            return kind.getDefaultRange();
        }
        return kind.getDefaultRange().overriddenBy(override.getMin(), override.getMax());
    }

    private String describe(Double bound) {
        return bound != null ? bound.toString() : "unbounded";
    }
}
