package com.logs.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error body returned for every non-2xx response")
public record ErrorResponse(
        @Schema(description = "Human-readable reason", example = "No log data provided")
        String error) {}
