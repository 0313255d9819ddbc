package com.fuer.measurement.service.api.advice;

import com.fuer.measurement.service.api.controller.LegacyMeasurementController;
import com.fuer.measurement.service.api.dto.LegacyErrorResponse;
import com.fuer.measurement.service.error.KindNotEnabledException;
import com.fuer.measurement.service.error.MalformedPayloadException;
import com.fuer.measurement.service.error.MeasurementException;
import com.fuer.measurement.service.error.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Error mapping for the v1 batch API, which answers with {@code {"error": "..."}} bodies.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(assignableTypes = LegacyMeasurementController.class)
public class LegacyExceptionHandler {

    @ExceptionHandler(KindNotEnabledException.class)
    public ResponseEntity<LegacyErrorResponse> handleKindNotEnabled(KindNotEnabledException ex) {
        log.warn("Invalid measurement type: {}", ex.getKind());
        return error(HttpStatus.BAD_REQUEST, "Unknown measurement type " + ex.getKind() + ".");
    }

    @ExceptionHandler(MalformedPayloadException.class)
    public ResponseEntity<LegacyErrorResponse> handleMalformed(MalformedPayloadException ex) {
        log.warn("Invalid batch: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid JSON or missing 'values' field.");
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<LegacyErrorResponse> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Error accessing measurements: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler({MeasurementException.class, IllegalArgumentException.class})
    public ResponseEntity<LegacyErrorResponse> handleOther(RuntimeException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private ResponseEntity<LegacyErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new LegacyErrorResponse(message));
    }
}
