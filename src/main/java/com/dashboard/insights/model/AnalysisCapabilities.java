package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Set;

@Schema(description = "Forecast and decomposition models this instance can run")
public record AnalysisCapabilities(Set<ForecastModel> forecastModels,
                                   List<DecompositionModel> decompositionModels) {
}
