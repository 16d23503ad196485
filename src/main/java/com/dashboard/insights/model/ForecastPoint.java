package com.dashboard.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param step  1-based distance from the last observation
 * @param index position in the extended series (history length + step - 1)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastPoint(int step, int index, double value, Double lower, Double upper) {

    public static ForecastPoint point(int step, int index, double value) {
        return new ForecastPoint(step, index, value, null, null);
    }
}
