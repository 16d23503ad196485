package com.dashboard.insights.trend.forecast;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.exception.ModelConvergenceException;
import com.dashboard.insights.math.NelderMeadOptimizer;
import com.dashboard.insights.math.NormalDistribution;
import com.dashboard.insights.math.SeriesStatistics;
import com.dashboard.insights.model.ArimaOrder;
import com.dashboard.insights.model.ForecastModel;
import com.dashboard.insights.model.ForecastPoint;
import com.dashboard.insights.model.ForecastResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * ARIMA(p, d, q) fitted by conditional sum of squares.
 *
 * The series is differenced d times (and demeaned when d = 0). AR and MA coefficients are
 * searched in an unconstrained space and mapped through partial autocorrelations, which
 * keeps the AR part stationary and the MA part invertible. Forecasts are integrated back
 * to the original scale; intervals come from the psi-weights of the integrated model.
 */
@Component
public class ArimaForecaster implements ForecastStrategy {

    private static final Logger log = LoggerFactory.getLogger(ArimaForecaster.class);

    private static final double TOLERANCE = 1e-9;

    private final int maxIterations;
    private final double z;

    public ArimaForecaster(TrendConfig config) {
        this.maxIterations = config.getForecast().getMaxIterations();
        double confidence = config.getForecast().getArima().getConfidenceLevel();
        if (!(confidence > 0 && confidence < 1)) {
            throw new InvalidConfigurationException("ARIMA confidence level must be in (0, 1), got " + confidence);
        }
        this.z = NormalDistribution.inverseCdf(1.0 - (1.0 - confidence) / 2.0);
    }

    @Override
    public ForecastModel model() {
        return ForecastModel.ARIMA;
    }

    @Override
    public ForecastResult forecast(double[] history, ForecastOptions options) {
        ArimaOrder order = options.arimaOrder();
        int p = order.p();
        int d = order.d();
        int q = order.q();

        // levels[k] is the series differenced k times
        double[][] levels = new double[d + 1][];
        levels[0] = history.clone();
        for (int k = 1; k <= d; k++) {
            levels[k] = SeriesStatistics.diff(levels[k - 1]);
        }
        double[] w = levels[d];
        int effective = w.length - p;
        if (effective <= p + q + 1) {
            throw new ModelConvergenceException(String.format(
                    "ARIMA%s needs more history: %d points after differencing", order, w.length));
        }

        double mean = d == 0 ? SeriesStatistics.mean(w) : 0.0;
        double[] centered = new double[w.length];
        for (int i = 0; i < w.length; i++) centered[i] = w[i] - mean;

        double[] ar = new double[p];
        double[] ma = new double[q];
        double css;
        if (p + q > 0) {
            NelderMeadOptimizer optimizer = new NelderMeadOptimizer(maxIterations, TOLERANCE, 0.5);
            NelderMeadOptimizer.Result fit = optimizer.minimize(
                    theta -> conditionalSumOfSquares(centered, arCoefficients(theta, p), maCoefficients(theta, p, q)),
                    new double[p + q]);
            if (!fit.converged()) {
                throw new ModelConvergenceException(String.format(
                        "ARIMA%s did not converge within %d iterations", order, fit.iterations()));
            }
            ar = arCoefficients(fit.point(), p);
            ma = maCoefficients(fit.point(), p, q);
            css = fit.value();
        } else {
            css = conditionalSumOfSquares(centered, ar, ma);
        }

        double sigma2 = css / effective;
        if (!Double.isFinite(sigma2) || sigma2 <= 0) {
            throw new ModelConvergenceException("ARIMA" + order + " has a degenerate innovation variance: " + sigma2);
        }
        log.debug("ARIMA{} fitted: ar={}, ma={}, sigma2={}", order, Arrays.toString(ar), Arrays.toString(ma), sigma2);

        int horizon = options.horizon();
        double[] differenced = forecastDifferenced(centered, ar, ma, horizon);
        for (int h = 0; h < horizon; h++) differenced[h] += mean;
        double[] values = integrate(levels, differenced);
        double[] psi = psiWeights(ar, ma, d, horizon);

        List<ForecastPoint> points = new ArrayList<>(horizon);
        double variance = 0.0;
        for (int step = 1; step <= horizon; step++) {
            variance += sigma2 * psi[step - 1] * psi[step - 1];
            double halfWidth = z * Math.sqrt(variance);
            double value = values[step - 1];
            points.add(new ForecastPoint(step, history.length + step - 1, value, value - halfWidth, value + halfWidth));
        }

        ForecastResult.ForecastResultBuilder result = ForecastResult.builder()
                .model(ForecastModel.ARIMA)
                .points(points);
        for (int i = 0; i < p; i++) result.parameter("ar.L" + (i + 1), ar[i]);
        for (int j = 0; j < q; j++) result.parameter("ma.L" + (j + 1), ma[j]);
        if (d == 0) result.parameter("const", mean);
        return result.parameter("sigma2", sigma2).build();
    }

    /**
     * Sum of squared innovations for t >= p, with earlier innovations taken as zero.
     */
    static double conditionalSumOfSquares(double[] w, double[] ar, double[] ma) {
        int p = ar.length;
        double[] e = new double[w.length];
        double sum = 0.0;
        for (int t = p; t < w.length; t++) {
            double prediction = 0.0;
            for (int i = 0; i < p; i++) prediction += ar[i] * w[t - 1 - i];
            for (int j = 0; j < ma.length && t - 1 - j >= 0; j++) prediction += ma[j] * e[t - 1 - j];
            e[t] = w[t] - prediction;
            sum += e[t] * e[t];
        }
        return sum;
    }

    static double[] forecastDifferenced(double[] w, double[] ar, double[] ma, int horizon) {
        int n = w.length;
        int p = ar.length;
        double[] e = new double[n + horizon];
        double[] extended = new double[n + horizon];
        System.arraycopy(w, 0, extended, 0, n);
        for (int t = p; t < n; t++) {
            double prediction = 0.0;
            for (int i = 0; i < p; i++) prediction += ar[i] * w[t - 1 - i];
            for (int j = 0; j < ma.length && t - 1 - j >= 0; j++) prediction += ma[j] * e[t - 1 - j];
            e[t] = w[t] - prediction;
        }

        double[] out = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            int t = n + h;
            double value = 0.0;
            for (int i = 0; i < p; i++) {
                if (t - 1 - i >= 0) value += ar[i] * extended[t - 1 - i];
            }
            for (int j = 0; j < ma.length; j++) {
                if (t - 1 - j >= 0) value += ma[j] * e[t - 1 - j];
            }
            extended[t] = value;
            out[h] = value;
        }
        return out;
    }

    /**
     * Undoes the differencing, one level at a time, anchored on each level's last observation.
     */
    static double[] integrate(double[][] levels, double[] differenced) {
        double[] current = differenced;
        for (int k = levels.length - 2; k >= 0; k--) {
            double[] lower = levels[k];
            double running = lower[lower.length - 1];
            double[] next = new double[current.length];
            for (int h = 0; h < current.length; h++) {
                running += current[h];
                next[h] = running;
            }
            current = next;
        }
        return current;
    }

    /**
     * MA(infinity) weights of phi(B)(1 - B)^d x = theta(B) e, first {@code count} terms.
     */
    static double[] psiWeights(double[] ar, double[] ma, int d, int count) {
        // full AR polynomial 1 - sum(a_i B^i), as the coefficients a_i
        double[] poly = new double[ar.length + 1];
        poly[0] = 1.0;
        for (int i = 0; i < ar.length; i++) poly[i + 1] = -ar[i];
        for (int k = 0; k < d; k++) {
            double[] next = new double[poly.length + 1];
            for (int i = 0; i < poly.length; i++) {
                next[i] += poly[i];
                next[i + 1] -= poly[i];
            }
            poly = next;
        }

        double[] psi = new double[count];
        psi[0] = 1.0;
        for (int j = 1; j < count; j++) {
            double value = j <= ma.length ? ma[j - 1] : 0.0;
            for (int i = 1; i < poly.length && i <= j; i++) {
                value -= poly[i] * psi[j - i];
            }
            psi[j] = value;
        }
        return psi;
    }

    static double[] arCoefficients(double[] theta, int p) {
        double[] partials = new double[p];
        for (int i = 0; i < p; i++) partials[i] = bounded(theta[i]);
        return durbinLevinson(partials);
    }

    static double[] maCoefficients(double[] theta, int p, int q) {
        double[] partials = new double[q];
        for (int j = 0; j < q; j++) partials[j] = bounded(theta[p + j]);
        double[] stationary = durbinLevinson(partials);
        for (int j = 0; j < q; j++) stationary[j] = -stationary[j];
        return stationary;
    }

    /** Maps the real line onto (-1, 1). */
    private static double bounded(double x) {
        return x / Math.sqrt(1.0 + x * x);
    }

    /**
     * Coefficients of a stationary AR polynomial from partial autocorrelations in (-1, 1).
     */
    static double[] durbinLevinson(double[] partials) {
        int n = partials.length;
        double[] phi = new double[n];
        for (int k = 0; k < n; k++) {
            double[] previous = phi.clone();
            double r = partials[k];
            for (int i = 0; i < k; i++) {
                phi[i] = previous[i] - r * previous[k - 1 - i];
            }
            phi[k] = r;
        }
        return phi;
    }
}
