package com.dashboard.insights.service;

import com.dashboard.insights.config.MetricsConfig;
import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.AnalysisException;
import com.dashboard.insights.model.AnalysisCapabilities;
import com.dashboard.insights.model.ArimaOrder;
import com.dashboard.insights.model.DecompositionModel;
import com.dashboard.insights.model.DecompositionResult;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastRequest;
import com.dashboard.insights.model.ForecastResponse;
import com.dashboard.insights.model.GrowthMetrics;
import com.dashboard.insights.model.MethodFailure;
import com.dashboard.insights.model.ObservationSeries;
import com.dashboard.insights.model.PeaksAndTroughs;
import com.dashboard.insights.model.SeasonalityResult;
import com.dashboard.insights.model.StationarityResult;
import com.dashboard.insights.model.TrendAnalysisRequest;
import com.dashboard.insights.model.TrendReport;
import com.dashboard.insights.trend.PeakTroughLocator;
import com.dashboard.insights.trend.SeasonalDecomposer;
import com.dashboard.insights.trend.SeasonalityDetector;
import com.dashboard.insights.trend.StationarityTester;
import com.dashboard.insights.trend.TrendCharacterizer;
import com.dashboard.insights.trend.TrendLine;
import com.dashboard.insights.trend.forecast.ForecastBatch;
import com.dashboard.insights.trend.forecast.ForecastOptions;
import com.dashboard.insights.trend.forecast.Forecaster;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Trend characterization, decomposition and forecasting for one metric column.
 *
 * Missing values are dropped before analysis. The linear direction is required; every
 * other component is isolated, so a failure leaves that part of the report null and adds
 * an entry to the report's failure list.
 */
@Service
public class TrendAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalysisService.class);

    private final DatasetReader datasetReader;
    private final TrendCharacterizer characterizer;
    private final SeasonalityDetector seasonalityDetector;
    private final StationarityTester stationarityTester;
    private final PeakTroughLocator peakTroughLocator;
    private final SeasonalDecomposer decomposer;
    private final Forecaster forecaster;
    private final TrendConfig config;
    private final MetricsConfig metricsConfig;

    public TrendAnalysisService(DatasetReader datasetReader,
                                TrendCharacterizer characterizer,
                                SeasonalityDetector seasonalityDetector,
                                StationarityTester stationarityTester,
                                PeakTroughLocator peakTroughLocator,
                                SeasonalDecomposer decomposer,
                                Forecaster forecaster,
                                TrendConfig config,
                                MetricsConfig metricsConfig) {
        this.datasetReader = datasetReader;
        this.characterizer = characterizer;
        this.seasonalityDetector = seasonalityDetector;
        this.stationarityTester = stationarityTester;
        this.peakTroughLocator = peakTroughLocator;
        this.decomposer = decomposer;
        this.forecaster = forecaster;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "trend.analyze", contextualName = "analyze-trend")
    public TrendReport analyze(TrendAnalysisRequest request) {
        ForecastOptions options = forecastOptions(request.getHorizon(), request.getSeasonalPeriod(),
                request.getArimaOrder());
        ObservationSeries series = datasetReader.readColumn(request.getDataset(), request.getValueColumn())
                .withoutMissing();
        double[] values = series.values();

        TrendLine line = characterizer.direction(values);
        List<MethodFailure> failures = new ArrayList<>();

        SeasonalityResult seasonality = attempt("SEASONALITY", () -> seasonalityDetector.detect(values), failures);
        GrowthMetrics growth = attempt("GROWTH", () -> characterizer.growth(values), failures);
        PeaksAndTroughs extrema = attempt("PEAKS_TROUGHS",
                () -> peakTroughLocator.locate(values, request.getMinProminence()), failures);

        StationarityResult stationarity = attempt("STATIONARITY", () -> stationarityTester.test(values), failures);
        if (stationarity != null && stationarity.getError() != null) {
            failures.add(new MethodFailure("STATIONARITY", stationarity.getError()));
            metricsConfig.recordTrendComponentFailure("STATIONARITY");
        }

        int period = request.getSeasonalPeriod() != null ? request.getSeasonalPeriod() : config.getDecompositionPeriod();
        DecompositionModel model = request.getDecompositionModel() != null
                ? request.getDecompositionModel() : config.getDecompositionModel();
        DecompositionResult decomposition = attempt("DECOMPOSITION",
                () -> decomposer.decompose(values, period, model), failures);

        ForecastBatch forecasts = forecaster.forecastAll(values, options);
        failures.addAll(forecasts.failures());

        log.info("Trend analysis of {} over {} points: {} (slope={}, R2={}), {} forecasts, {} failed components",
                series.getName(), values.length, line.direction(), line.slope(), line.strength(),
                forecasts.results().size(), failures.size());

        return TrendReport.builder()
                .metric(series.getName())
                .observations(values.length)
                .direction(line.direction())
                .slope(line.slope())
                .strength(line.strength())
                .movingAverage(characterizer.movingAverage(values))
                .seasonality(seasonality)
                .growth(growth)
                .stationarity(stationarity)
                .peaksAndTroughs(extrema)
                .decomposition(decomposition)
                .forecasts(forecasts.results())
                .failures(failures)
                .build();
    }

    @Observed(name = "trend.forecast", contextualName = "forecast-metric")
    public ForecastResponse forecast(ForecastRequest request) {
        ForecastOptions options = forecastOptions(request.getHorizon(), request.getSeasonalPeriod(),
                request.getArimaOrder());
        ObservationSeries series = datasetReader.readColumn(request.getDataset(), request.getValueColumn())
                .withoutMissing();

        List<ForecastModel> models =
                request.getModels() == null ? List.of() : request.getModels();
        ForecastBatch batch = forecaster.forecast(series.values(), options, models);

        log.info("Forecast of {} ({} points, horizon {}): {} succeeded, {} failed",
                series.getName(), series.size(), options.horizon(),
                batch.results().size(), batch.failures().size());
        return ForecastResponse.builder()
                .metric(series.getName())
                .forecasts(batch.results())
                .failures(batch.failures())
                .build();
    }

    public AnalysisCapabilities capabilities() {
        return new AnalysisCapabilities(forecaster.capabilities(), Arrays.asList(DecompositionModel.values()));
    }

    private ForecastOptions forecastOptions(Integer horizon, Integer seasonalPeriod, ArimaOrder arimaOrder) {
        TrendConfig.Forecast defaults = config.getForecast();
        TrendConfig.Arima arima = defaults.getArima();
        return new ForecastOptions(
                horizon != null ? horizon : defaults.getHorizon(),
                seasonalPeriod != null ? seasonalPeriod : defaults.getSeasonalPeriod(),
                arimaOrder != null ? arimaOrder : new ArimaOrder(arima.getP(), arima.getD(), arima.getQ()));
    }

    private <T> T attempt(String component, Supplier<T> work, List<MethodFailure> failures) {
        try {
            return work.get();
        } catch (AnalysisException e) {
            log.warn("Trend component {} skipped: {}", component, e.getMessage());
            failures.add(new MethodFailure(component, e.getMessage()));
            metricsConfig.recordTrendComponentFailure(component);
        } catch (RuntimeException e) {
            log.error("Unexpected error in trend component {}: {}", component, e.getMessage(), e);
            failures.add(new MethodFailure(component, e.getClass().getSimpleName() + ": " + e.getMessage()));
            metricsConfig.recordTrendComponentFailure(component);
        }
        return null;
    }
}
