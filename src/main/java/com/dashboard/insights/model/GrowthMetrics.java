package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Growth metrics in percent. Null when history is insufficient or the base is zero.")
public class GrowthMetrics {

    @Schema(description = "Percent change of the last step", example = "1.8")
    Double momGrowth;

    @Schema(description = "Percent change against the value 364 steps back (needs 365 points)", example = "42.0")
    Double yoyGrowth;

    @Schema(description = "Compound annual growth rate (needs 365 points and a positive first value)", example = "48.1")
    Double cagr;

    @Schema(description = "Mean of step percent changes", example = "0.12")
    Double avgGrowthRate;

    @Schema(description = "Last value", example = "120345.0")
    double currentValue;

    @Schema(description = "First value", example = "80120.0")
    double startValue;
}
