package com.dashboard.insights.config;

import com.dashboard.insights.model.DecompositionModel;
import com.dashboard.insights.model.ForecastModel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "insights.trend")
public class TrendConfig {

    // Slopes within +/- this value are Stable. Units follow the metric.
    private double slopeThreshold = 0.01;

    private int movingAverageWindow = 30;

    private int maxSeasonalityLag = 365;

    // Minimum autocorrelation for a seasonal peak
    private double seasonalityMinHeight = 0.5;

    private double stationaritySignificance = 0.05;

    // Default peak/trough prominence as a fraction of the value range
    private double peakProminenceFraction = 0.1;

    private int decompositionPeriod = 7;

    private DecompositionModel decompositionModel = DecompositionModel.ADDITIVE;

    private Forecast forecast = new Forecast();

    @Data
    public static class Forecast {
        private int horizon = 30;
        private int seasonalPeriod = 7;
        private Set<ForecastModel> enabledModels = EnumSet.allOf(ForecastModel.class);
        private Arima arima = new Arima();
        private int maxIterations = 2000;
    }

    @Data
    public static class Arima {
        private int p = 1;
        private int d = 1;
        private int q = 1;
        private double confidenceLevel = 0.95;
    }
}
