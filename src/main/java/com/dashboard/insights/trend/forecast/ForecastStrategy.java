package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastResult;

/**
 * One forecasting model. Fitted state lives only inside {@link #forecast}.
 */
public interface ForecastStrategy {

    ForecastModel model();

    /**
     * Fit the model to {@code history} and predict {@code options.horizon()} steps ahead.
     *
     * @param history gap-free values in time order
     */
    ForecastResult forecast(double[] history, ForecastOptions options);
}
