package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.model.ArimaOrder;

/**
 * Per-call forecasting parameters.
 *
 * @param seasonalPeriod cycle length for seasonal models
 * @param arimaOrder     (p, d, q) for the ARIMA model
 */
public record ForecastOptions(int horizon, int seasonalPeriod, ArimaOrder arimaOrder) {

    public ForecastOptions {
        if (horizon < 1) {
            throw new InvalidConfigurationException("Forecast horizon must be at least 1, got " + horizon);
        }
        if (seasonalPeriod < 2) {
            throw new InvalidConfigurationException("Seasonal period must be at least 2, got " + seasonalPeriod);
        }
        if (arimaOrder == null) {
            throw new InvalidConfigurationException("ARIMA order is required");
        }
    }
}
