package com.openrangelabs.nycdata.sync.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Standard error response structure for API errors.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard error response structure")
public class ErrorResponse {

    @Schema(description = "When the error occurred", example = "2025-01-15T10:30:00")
    LocalDateTime timestamp;

    @Schema(description = "HTTP status code", example = "404")
    int status;

    @Schema(description = "Error type", example = "Dataset Not Found")
    String error;

    @Schema(description = "Detailed error message", example = "Dataset not found: usep-8jbt")
    String message;

    @Schema(description = "Request path that caused the error", example = "/api/datasets/usep-8jbt")
    String path;

    @Schema(description = "Unique trace ID for debugging", example = "a1b2c3d4")
    String traceId;
}
