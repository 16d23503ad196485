package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.model.ArimaOrder;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastPoint;
import com.dashboard.insights.model.ForecastResult;
import com.dashboard.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearTrendForecasterTest {

    private final LinearTrendForecaster forecaster = new LinearTrendForecaster();

    @Test
    void forecast_continuesExactLine() {
        double[] history = TestDataFactory.linear(10, 100.0, 10.0);

        ForecastResult result = forecaster.forecast(history, new ForecastOptions(3, 7, new ArimaOrder(1, 1, 1)));

        assertThat(result.getModel()).isEqualTo(ForecastModel.LINEAR_TREND);
        assertThat(result.getHorizon()).isEqualTo(3);
        ForecastPoint first = result.getPoints().get(0);
        assertThat(first.step()).isEqualTo(1);
        assertThat(first.index()).isEqualTo(10);
        assertThat(first.value()).isCloseTo(200.0, within(1e-9));
        assertThat(first.lower()).isNull();
        assertThat(result.getPoints().get(2).value()).isCloseTo(220.0, within(1e-9));
        assertThat(result.getParameters()).containsKeys("slope", "intercept", "rSquared");
        assertThat(result.getParameters().get("slope")).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void forecast_singlePoint_throwsInsufficientData() {
        assertThatThrownBy(() -> forecaster.forecast(new double[]{5.0}, new ForecastOptions(1, 7, new ArimaOrder(1, 1, 1))))
                .isInstanceOf(InsufficientDataException.class);
    }
}
