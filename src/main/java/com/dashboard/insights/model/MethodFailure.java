package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A detection, decomposition or forecasting method that did not produce a result")
public record MethodFailure(
        @Schema(description = "Method label", example = "ISOLATION_FOREST") String method,
        @Schema(description = "Why the method did not run", example = "Isolation forest needs at least 2 rows, got 1")
        String reason) {
}
