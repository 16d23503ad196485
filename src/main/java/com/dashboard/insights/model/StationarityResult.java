package com.dashboard.insights.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "Augmented Dickey-Fuller stationarity test")
public class StationarityResult {

    @Schema(description = "True when the p-value is below the significance level; null if the test could not run",
            example = "false")
    Boolean stationary;

    @Schema(description = "ADF t-statistic of the lagged level", example = "-1.92")
    Double adfStatistic;

    @JsonProperty("pValue")
    @Schema(description = "MacKinnon approximate p-value", example = "0.32")
    Double pValue;

    @Schema(description = "Critical values keyed by level (1%, 5%, 10%)")
    Map<String, Double> criticalValues;

    @Schema(description = "Number of lagged differences chosen by AIC", example = "6")
    Integer usedLag;

    @Schema(description = "Observations used in the regression", example = "358")
    Integer nobs;

    @Schema(description = "True when the series is constant and the test is skipped", example = "false")
    boolean degenerate;

    @Schema(description = "Why the test could not run")
    String error;

    public static StationarityResult failed(String reason) {
        return StationarityResult.builder().error(reason).build();
    }
}
