package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.model.ForecastResult;
import com.dashboard.insights.model.MethodFailure;

import java.util.List;

/**
 * Results of the models that succeeded plus one failure entry per model that did not.
 */
public record ForecastBatch(List<ForecastResult> results, List<MethodFailure> failures) {

    public ForecastBatch {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }
}
