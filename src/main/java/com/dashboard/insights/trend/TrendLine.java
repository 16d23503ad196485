package com.dashboard.insights.trend;

import com.dashboard.insights.model.TrendDirection;

/**
 * Direction and strength of the least squares line through a series.
 *
 * @param strength R-squared of the fit
 */
public record TrendLine(TrendDirection direction, double slope, double intercept, double strength) {
}
