package com.stride.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every Stride endpoint and by the security filter chain.
 * Authentication failures never say which check failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "ApiError")
public class ApiError {

    private Instant timestamp;
    private String path;
    private int status;
    private String error;

    @Schema(description = "Stable machine-readable code",
            allowableValues = {"BAD_REQUEST", "UNAUTHORIZED", "FORBIDDEN", "CONFLICT", "INTERNAL_SERVER_ERROR"})
    private String errorCode;

    @Schema(example = "Authentication failed")
    private String message;

    @Schema(description = "Echo of the X-Request-Id header or the generated id")
    private String requestId;

    @Schema(description = "Correlation id also stored on audit events written for this request")
    private String correlationId;

    @Schema(description = "Field-level validation errors; empty for other failures")
    private List<ApiErrorDetail> details;
}
