package com.fintech.ticks.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 * Follows RFC 7807 Problem Details for HTTP APIs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "404")
    int status,

    @Schema(description = "Error type/category", example = "UNKNOWN_SYMBOL")
    String error,

    @Schema(description = "Human-readable error message", example = "Symbol is not tracked: TSLA")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/symbols/TSLA/mean")
    String path,

    @Schema(description = "Timestamp of the error", example = "2025-12-09T10:30:00Z")
    Instant timestamp
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now());
    }
}
