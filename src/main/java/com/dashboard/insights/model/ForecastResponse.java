package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Forecasts from every requested model that succeeded, plus the ones that failed")
public class ForecastResponse {

    @Schema(description = "Forecasted metric", example = "TotalSales")
    private String metric;

    private List<ForecastResult> forecasts;

    private List<MethodFailure> failures;
}
