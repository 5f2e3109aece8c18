package dev.aparikh.scanerrors.api;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response DTO for the error count API.
 */
@Schema(description = "Error count response")
public record ErrorCountResponse(
        @Schema(description = "Number of errors matching the filters", example = "42")
        long count
) {
}
