/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Standardized error payload for REST responses.
 *
 * @param errorCode machine-readable error code
 * @param message human-readable error message
 * @param path request path that failed, if known
 * @param status HTTP status code
 * @param timestamp server-side error timestamp
 */
@Schema(description = "API error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDTO(
        @Schema(description = "Error code for programmatic handling") String errorCode,
        @Schema(description = "Error message describing what went wrong") String message,
        @Schema(description = "Request path") String path,
        @Schema(description = "HTTP status code") Integer status,
        @Schema(description = "Timestamp when the error occurred") Instant timestamp) {

    public static ErrorResponseDTO of(String errorCode, String message, String path, int status) {
        return new ErrorResponseDTO(errorCode, message, path, status, Instant.now());
    }
}
