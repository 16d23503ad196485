package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.config.MetricsConfig;
import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.exception.ModelConvergenceException;
import com.dashboard.insights.model.ArimaOrder;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastResult;
import com.dashboard.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ForecasterTest {

    private static final ForecastOptions OPTIONS = new ForecastOptions(5, 7, new ArimaOrder(1, 1, 1));

    @Mock private MetricsConfig metricsConfig;
    @Mock private ForecastStrategy arima;

    private TrendConfig config;

    @BeforeEach
    void setUp() {
        config = new TrendConfig();
    }

    @Test
    void forecastAll_failingModelIsolated() {
        when(arima.model()).thenReturn(ForecastModel.ARIMA);
        when(arima.forecast(any(), any())).thenThrow(new ModelConvergenceException("no fit"));
        Forecaster forecaster = new Forecaster(List.of(new LinearTrendForecaster(), arima), config, metricsConfig);

        ForecastBatch batch = forecaster.forecastAll(TestDataFactory.linear(30, 1, 1), OPTIONS);

        assertThat(batch.results()).extracting(ForecastResult::getModel).containsExactly(ForecastModel.LINEAR_TREND);
        assertThat(batch.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.method()).isEqualTo("ARIMA");
            assertThat(failure.reason()).isEqualTo("no fit");
        });
        verify(metricsConfig).recordForecast("LINEAR_TREND", "success");
        verify(metricsConfig).recordForecast("ARIMA", "failure");
    }

    @Test
    void forecastAll_unexpectedErrorIsolated() {
        when(arima.model()).thenReturn(ForecastModel.ARIMA);
        when(arima.forecast(any(), any())).thenThrow(new IllegalStateException("bug"));
        Forecaster forecaster = new Forecaster(List.of(arima, new LinearTrendForecaster()), config, metricsConfig);

        ForecastBatch batch = forecaster.forecastAll(TestDataFactory.linear(30, 1, 1), OPTIONS);

        assertThat(batch.results()).hasSize(1);
        assertThat(batch.failures().get(0).reason()).contains("IllegalStateException");
        verify(metricsConfig).recordForecast("ARIMA", "error");
    }

    @Test
    void capabilities_onlyEnabledModelsWithImplementation() {
        config.getForecast().setEnabledModels(EnumSet.of(ForecastModel.LINEAR_TREND, ForecastModel.EXPONENTIAL_SMOOTHING));
        Forecaster forecaster = new Forecaster(List.of(new LinearTrendForecaster()), config, metricsConfig);

        assertThat(forecaster.capabilities()).containsExactly(ForecastModel.LINEAR_TREND);
    }

    @Test
    void forecast_requestedModelNotEnabled_rejected() {
        config.getForecast().setEnabledModels(EnumSet.of(ForecastModel.LINEAR_TREND));
        Forecaster forecaster = new Forecaster(List.of(new LinearTrendForecaster()), config, metricsConfig);

        assertThatThrownBy(() -> forecaster.forecast(TestDataFactory.linear(30, 1, 1), OPTIONS,
                List.of(ForecastModel.ARIMA)))
                .isInstanceOf(InvalidConfigurationException.class);
        verify(metricsConfig, never()).recordForecast(any(), any());
    }

    @Test
    void forecast_emptySelection_runsAllEnabledInDeclaredOrder() {
        TrendConfig trendConfig = new TrendConfig();
        Forecaster forecaster = new Forecaster(List.of(
                new ArimaForecaster(trendConfig),
                new ExponentialSmoothingForecaster(trendConfig),
                new LinearTrendForecaster()), trendConfig, metricsConfig);

        double[] steps = TestDataFactory.gaussian(120, 1.0, 3.0, 5L);
        double[] history = new double[120];
        history[0] = 200.0;
        for (int i = 1; i < history.length; i++) history[i] = history[i - 1] + steps[i];

        ForecastBatch batch = forecaster.forecast(history, OPTIONS, List.of());

        assertThat(batch.failures()).isEmpty();
        assertThat(batch.results()).extracting(ForecastResult::getModel).containsExactly(
                ForecastModel.LINEAR_TREND, ForecastModel.EXPONENTIAL_SMOOTHING, ForecastModel.ARIMA);
        assertThat(batch.results()).allSatisfy(result -> assertThat(result.getHorizon()).isEqualTo(5));
    }
}
