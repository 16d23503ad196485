package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Autocorrelation-based seasonality detection")
public class SeasonalityResult {

    @Schema(description = "Whether an autocorrelation peak of at least the minimum height exists", example = "true")
    boolean hasSeasonality;

    @Schema(description = "Lag of the first autocorrelation peak", example = "7")
    Integer primaryPeriod;

    @Schema(description = "Lags of all autocorrelation peaks", example = "[7, 14, 21]")
    List<Integer> peakLags;

    public static SeasonalityResult none() {
        return SeasonalityResult.builder().hasSeasonality(false).peakLags(List.of()).build();
    }
}
