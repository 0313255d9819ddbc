package com.fuer.measurement.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body of the v1 batch API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LegacyErrorResponse {

    private String error;
}
