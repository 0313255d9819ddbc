package com.fuer.measurement.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Measurement Service Application - Entry point for the Spring Boot application.
 *
 * The measurement kinds this instance serves are passed as positional arguments:
 * <pre>
 *   java -jar measurement-service.jar power flow
 * </pre>
 * The service then:
 * - Creates one storage table per enabled kind
 * - Accepts readings of those kinds (POST /measurements)
 * - Serves stored readings and aggregates back (GET /measurements)
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.fuer.measurement.service.config")
public class MeasurementServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeasurementServiceApplication.class, args);
    }
}
