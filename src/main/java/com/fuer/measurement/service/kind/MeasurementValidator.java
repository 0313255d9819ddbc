package com.fuer.measurement.service.kind;

import com.fuer.measurement.service.model.Reading;

/**
 * Kind-specific validation and normalization of a well-typed reading.
 */
@FunctionalInterface
public interface MeasurementValidator {

    /**
     * Validates the reading and returns its normalized form.
     *
     * @param reading a reading whose fields are already well-typed
     * @return the normalized reading
     * @throws com.fuer.measurement.service.error.OutOfRangeException if the value violates a bound
     */
    Reading validate(Reading reading);
}
