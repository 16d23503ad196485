package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Point forecasts (and intervals where the model supports them) from one model")
public class ForecastResult {

    @Schema(description = "Producing model", example = "ARIMA")
    ForecastModel model;

    List<ForecastPoint> points;

    @Singular
    @Schema(description = "Fitted model parameters", example = "{\"ar.L1\": 0.41, \"ma.L1\": -0.83}")
    Map<String, Double> parameters;

    public int getHorizon() { return points.size(); }
}
