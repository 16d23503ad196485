package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.config.MetricsConfig;
import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.AnalysisException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastResult;
import com.dashboard.insights.model.MethodFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the enabled forecasting models side by side. One model failing never
 * prevents the others from producing a forecast.
 */
@Component
public class Forecaster {

    private static final Logger log = LoggerFactory.getLogger(Forecaster.class);

    private final Map<ForecastModel, ForecastStrategy> strategies;
    private final Set<ForecastModel> enabled;
    private final MetricsConfig metricsConfig;

    public Forecaster(List<ForecastStrategy> strategies, TrendConfig config, MetricsConfig metricsConfig) {
        this.strategies = new EnumMap<>(ForecastModel.class);
        this.metricsConfig = metricsConfig;
        for (ForecastStrategy strategy : strategies) {
            this.strategies.put(strategy.model(), strategy);
            log.info("Registered forecast model: {} -> {}", strategy.model(), strategy.getClass().getSimpleName());
        }

        Set<ForecastModel> configured = config.getForecast().getEnabledModels();
        EnumSet<ForecastModel> available = EnumSet.noneOf(ForecastModel.class);
        if (configured != null) {
            for (ForecastModel model : configured) {
                if (this.strategies.containsKey(model)) {
                    available.add(model);
                } else {
                    log.warn("Forecast model {} is enabled but has no implementation", model);
                }
            }
        }
        this.enabled = Collections.unmodifiableSet(available);
    }

    /**
     * Models that {@link #forecastAll} will run.
     */
    public Set<ForecastModel> capabilities() {
        return enabled;
    }

    public ForecastBatch forecastAll(double[] history, ForecastOptions options) {
        return forecast(history, options, enabled);
    }

    /**
     * Runs the requested models.
     *
     * @throws InvalidConfigurationException if a requested model is not enabled
     */
    public ForecastBatch forecast(double[] history, ForecastOptions options, Collection<ForecastModel> models) {
        for (ForecastModel model : models) {
            if (!enabled.contains(model)) {
                throw new InvalidConfigurationException("Forecast model " + model + " is not enabled");
            }
        }

        EnumSet<ForecastModel> toRun = EnumSet.noneOf(ForecastModel.class);
        toRun.addAll(models.isEmpty() ? enabled : models);

        List<ForecastResult> results = new ArrayList<>();
        List<MethodFailure> failures = new ArrayList<>();
        for (ForecastModel model : toRun) {
            try {
                results.add(strategies.get(model).forecast(history, options));
                metricsConfig.recordForecast(model.name(), "success");
            } catch (AnalysisException e) {
                log.warn("Forecast model {} failed: {}", model, e.getMessage());
                failures.add(new MethodFailure(model.name(), e.getMessage()));
                metricsConfig.recordForecast(model.name(), "failure");
            } catch (RuntimeException e) {
                log.error("Unexpected error in forecast model {}: {}", model, e.getMessage(), e);
                failures.add(new MethodFailure(model.name(), e.getClass().getSimpleName() + ": " + e.getMessage()));
                metricsConfig.recordForecast(model.name(), "error");
            }
        }
        return new ForecastBatch(results, failures);
    }
}
