package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Trend, seasonal and residual components of a series")
public class DecompositionResult {

    DecompositionModel model;

    @Schema(description = "Seasonal period", example = "7")
    int period;

    double[] observed;

    double[] trend;

    double[] seasonal;

    double[] residual;
}
