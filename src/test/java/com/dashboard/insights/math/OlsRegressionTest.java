package com.dashboard.insights.math;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OlsRegressionTest {

    @Test
    void fit_recoversCoefficients() {
        // y = 2 + 3*x1 - x2 with small alternating noise
        double[][] x = new double[20][3];
        double[] y = new double[20];
        for (int i = 0; i < 20; i++) {
            double x1 = i;
            double x2 = (i * 7) % 5;
            x[i] = new double[]{1.0, x1, x2};
            y[i] = 2 + 3 * x1 - x2 + (i % 2 == 0 ? 0.01 : -0.01);
        }

        OlsRegression fit = OlsRegression.fit(y, x);

        assertThat(fit.getCoefficients()[0]).isCloseTo(2.0, within(0.05));
        assertThat(fit.getCoefficients()[1]).isCloseTo(3.0, within(0.01));
        assertThat(fit.getCoefficients()[2]).isCloseTo(-1.0, within(0.01));
        assertThat(fit.getNobs()).isEqualTo(20);
        assertThat(Math.abs(fit.tValue(1))).isGreaterThan(100.0);
        assertThat(fit.aic()).isFinite();
    }

    @Test
    void fit_collinearColumns_throws() {
        double[][] x = {{1, 2}, {1, 2}, {1, 2}, {1, 2}};

        assertThatThrownBy(() -> OlsRegression.fit(new double[]{1, 2, 3, 4}, x))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void fit_tooFewObservations_throws() {
        double[][] x = {{1, 0}, {1, 1}};

        assertThatThrownBy(() -> OlsRegression.fit(new double[]{1, 2}, x))
                .isInstanceOf(ArithmeticException.class);
    }
}
