package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InsufficientHistoryException;
import com.dashboard.insights.exception.ModelConvergenceException;
import com.dashboard.insights.math.NelderMeadOptimizer;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastPoint;
import com.dashboard.insights.model.ForecastResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Holt-Winters smoothing with additive trend and additive seasonality.
 *
 * Level, trend and seasonal indices start from the first two cycles. The smoothing
 * weights alpha, beta and gamma are fitted by minimising the one-step-ahead squared
 * error; each is kept inside (0, 1) through a logistic transform.
 */
@Component
public class ExponentialSmoothingForecaster implements ForecastStrategy {

    private static final Logger log = LoggerFactory.getLogger(ExponentialSmoothingForecaster.class);

    private static final double[] INITIAL_WEIGHTS = {0.3, 0.1, 0.1};

    private final int maxIterations;

    public ExponentialSmoothingForecaster(TrendConfig config) {
        this.maxIterations = config.getForecast().getMaxIterations();
    }

    @Override
    public ForecastModel model() {
        return ForecastModel.EXPONENTIAL_SMOOTHING;
    }

    @Override
    public ForecastResult forecast(double[] history, ForecastOptions options) {
        int m = options.seasonalPeriod();
        int n = history.length;
        if (n < 2 * m) {
            throw new InsufficientHistoryException(m, n);
        }

        double[] start = new double[3];
        for (int i = 0; i < 3; i++) start[i] = logit(INITIAL_WEIGHTS[i]);

        NelderMeadOptimizer optimizer = new NelderMeadOptimizer(maxIterations, 1e-10, 0.5);
        NelderMeadOptimizer.Result result = optimizer.minimize(
                theta -> run(history, m, logistic(theta[0]), logistic(theta[1]), logistic(theta[2])).sse(),
                start);
        if (!result.converged()) {
            log.debug("Holt-Winters weights did not converge in {} iterations, using best point", result.iterations());
        }

        double alpha = logistic(result.point()[0]);
        double beta = logistic(result.point()[1]);
        double gamma = logistic(result.point()[2]);
        State state = run(history, m, alpha, beta, gamma);
        if (!Double.isFinite(state.sse())) {
            throw new ModelConvergenceException("Holt-Winters fit produced a non-finite error");
        }

        List<ForecastPoint> points = new ArrayList<>(options.horizon());
        for (int step = 1; step <= options.horizon(); step++) {
            double value = state.level() + step * state.trend() + state.seasonal()[n + (step - 1) % m];
            points.add(ForecastPoint.point(step, n + step - 1, value));
        }
        return ForecastResult.builder()
                .model(ForecastModel.EXPONENTIAL_SMOOTHING)
                .points(points)
                .parameter("alpha", alpha)
                .parameter("beta", beta)
                .parameter("gamma", gamma)
                .parameter("seasonalPeriod", (double) m)
                .parameter("sse", state.sse())
                .build();
    }

    /**
     * Runs the smoothing recursions over the history. {@code seasonal[t + m]} holds the
     * seasonal index of time t, so the first m entries are the initial indices.
     */
    static State run(double[] y, int m, double alpha, double beta, double gamma) {
        int n = y.length;
        double firstCycle = 0.0;
        double secondCycle = 0.0;
        for (int i = 0; i < m; i++) {
            firstCycle += y[i];
            secondCycle += y[m + i];
        }
        firstCycle /= m;
        secondCycle /= m;

        double level = firstCycle;
        double trend = (secondCycle - firstCycle) / m;
        double[] seasonal = new double[n + m];
        for (int i = 0; i < m; i++) {
            seasonal[i] = y[i] - firstCycle;
        }

        double sse = 0.0;
        for (int t = 0; t < n; t++) {
            double season = seasonal[t];
            double error = y[t] - (level + trend + season);
            sse += error * error;

            double previousLevel = level;
            double previousTrend = trend;
            level = alpha * (y[t] - season) + (1 - alpha) * (previousLevel + previousTrend);
            trend = beta * (level - previousLevel) + (1 - beta) * previousTrend;
            seasonal[t + m] = gamma * (y[t] - previousLevel - previousTrend) + (1 - gamma) * season;
        }
        return new State(level, trend, seasonal, sse);
    }

    private static double logistic(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private static double logit(double p) {
        return Math.log(p / (1.0 - p));
    }

    record State(double level, double trend, double[] seasonal, double sse) {}
}
