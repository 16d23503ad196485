package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.math.LinearFit;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastPoint;
import com.dashboard.insights.model.ForecastResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extends the least squares line through the history.
 */
@Component
public class LinearTrendForecaster implements ForecastStrategy {

    @Override
    public ForecastModel model() {
        return ForecastModel.LINEAR_TREND;
    }

    @Override
    public ForecastResult forecast(double[] history, ForecastOptions options) {
        int n = history.length;
        if (n < 2) {
            throw new InsufficientDataException("Linear trend forecast needs at least 2 points", 2, n);
        }
        LinearFit fit = LinearFit.overIndex(history);

        List<ForecastPoint> points = new ArrayList<>(options.horizon());
        for (int step = 1; step <= options.horizon(); step++) {
            int index = n + step - 1;
            points.add(ForecastPoint.point(step, index, fit.predict(index)));
        }
        return ForecastResult.builder()
                .model(ForecastModel.LINEAR_TREND)
                .points(points)
                .parameter("slope", fit.getSlope())
                .parameter("intercept", fit.getIntercept())
                .parameter("rSquared", fit.getRSquared())
                .build();
    }
}
