package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Trend characterization, decomposition and forecasts for one metric")
public class TrendReport {

    @Schema(description = "Analyzed metric column", example = "TotalSales")
    String metric;

    @Schema(description = "Number of points analyzed", example = "365")
    int observations;

    @Schema(description = "Direction of the least squares slope", example = "UPWARD")
    TrendDirection direction;

    @Schema(description = "Least squares slope per step", example = "109.6")
    double slope;

    @Schema(description = "R-squared of the linear fit, in [0, 1]", example = "0.78")
    double strength;

    @Schema(description = "Trailing moving average at the last point, null when history is shorter than the window",
            example = "118200.5")
    Double movingAverage;

    SeasonalityResult seasonality;

    GrowthMetrics growth;

    StationarityResult stationarity;

    PeaksAndTroughs peaksAndTroughs;

    @Schema(description = "Null when the series is too short for the seasonal period")
    DecompositionResult decomposition;

    List<ForecastResult> forecasts;

    @Schema(description = "Components that did not produce a result")
    List<MethodFailure> failures;
}
