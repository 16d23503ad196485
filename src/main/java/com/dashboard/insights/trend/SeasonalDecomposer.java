package com.dashboard.insights.trend;

import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.math.LinearFit;
import com.dashboard.insights.model.DecompositionModel;
import com.dashboard.insights.model.DecompositionResult;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Classical moving-average decomposition into trend, seasonal and residual components.
 *
 * <ul>
 *   <li>Trend: centered moving average of length {@code period} (a 2 x period filter for even
 *   periods). The undefined ends are extrapolated linearly from the nearest
 *   {@code period - 1} trend points.</li>
 *   <li>Seasonal: mean of the detrended series at each seasonal position, normalised to
 *   mean 0 (additive) or mean 1 (multiplicative), repeated over the series.</li>
 *   <li>Residual: what remains after removing trend and seasonal.</li>
 * </ul>
 */
@Component
public class SeasonalDecomposer {

    /**
     * Whether a series of {@code length} points can be decomposed with {@code period}.
     */
    public boolean canDecompose(int length, int period) {
        return period >= 2 && period < length / 2.0;
    }

    /**
     * Whether these values can be decomposed under the given model; multiplicative
     * decomposition also needs strictly positive values.
     */
    public boolean canDecompose(double[] values, int period, DecompositionModel model) {
        if (!canDecompose(values.length, period)) return false;
        return model != DecompositionModel.MULTIPLICATIVE || Arrays.stream(values).allMatch(v -> v > 0);
    }

    public DecompositionResult decompose(double[] values, int period, DecompositionModel model) {
        if (model == null) {
            throw new InvalidConfigurationException("Decomposition model is required");
        }
        int n = values.length;
        if (!canDecompose(n, period)) {
            throw new InsufficientDataException(String.format(
                    "Decomposition needs a period of at least 2 and more than two full cycles; period %d, %d points",
                    period, n), 2 * Math.max(period, 2) + 1, n);
        }
        if (model == DecompositionModel.MULTIPLICATIVE) {
            for (double v : values) {
                if (!(v > 0)) {
                    throw new InvalidConfigurationException(
                            "Multiplicative decomposition needs strictly positive values, found " + v);
                }
            }
        }

        double[] trend = centeredMovingAverage(values, period);
        extrapolateEnds(trend, period - 1);

        boolean additive = model == DecompositionModel.ADDITIVE;
        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = additive ? values[i] - trend[i] : values[i] / trend[i];
        }

        double[] positionMeans = new double[period];
        for (int p = 0; p < period; p++) {
            double sum = 0.0;
            int count = 0;
            for (int i = p; i < n; i += period) {
                if (Double.isFinite(detrended[i])) {
                    sum += detrended[i];
                    count++;
                }
            }
            positionMeans[p] = count == 0 ? (additive ? 0.0 : 1.0) : sum / count;
        }
        double overall = Arrays.stream(positionMeans).average().orElse(additive ? 0.0 : 1.0);
        for (int p = 0; p < period; p++) {
            positionMeans[p] = additive ? positionMeans[p] - overall : positionMeans[p] / overall;
        }

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = positionMeans[i % period];
            residual[i] = additive ? detrended[i] - seasonal[i] : detrended[i] / seasonal[i];
        }

        return DecompositionResult.builder()
                .model(model)
                .period(period)
                .observed(values.clone())
                .trend(trend)
                .seasonal(seasonal)
                .residual(residual)
                .build();
    }

    /**
     * Centered moving average; NaN where the window does not fit.
     */
    static double[] centeredMovingAverage(double[] x, int period) {
        double[] weights;
        if (period % 2 == 1) {
            weights = new double[period];
            Arrays.fill(weights, 1.0 / period);
        } else {
            weights = new double[period + 1];
            Arrays.fill(weights, 1.0 / period);
            weights[0] = 0.5 / period;
            weights[period] = 0.5 / period;
        }
        int half = weights.length / 2;

        double[] trend = new double[x.length];
        Arrays.fill(trend, Double.NaN);
        for (int i = half; i < x.length - half; i++) {
            double sum = 0.0;
            for (int j = 0; j < weights.length; j++) {
                sum += weights[j] * x[i - half + j];
            }
            trend[i] = sum;
        }
        return trend;
    }

    /**
     * Replaces the leading and trailing NaNs with least squares lines through the nearest
     * {@code points} defined values.
     */
    static void extrapolateEnds(double[] trend, int points) {
        int n = trend.length;
        int front = 0;
        while (front < n && Double.isNaN(trend[front])) front++;
        int back = n - 1;
        while (back >= 0 && Double.isNaN(trend[back])) back--;
        if (front > back) return;

        int frontLast = Math.min(front + Math.max(points, 1), n - 1);
        double[] head = fitLine(trend, front, Math.max(frontLast, front + 1));
        for (int i = 0; i < front; i++) {
            trend[i] = head[0] * i + head[1];
        }

        int backFirst = Math.max(back - Math.max(points, 1), 0);
        double[] tail = fitLine(trend, Math.min(backFirst, back - 1), back);
        for (int i = back + 1; i < n; i++) {
            trend[i] = tail[0] * i + tail[1];
        }
    }

    /** Least squares line through {@code trend[from..to)}, returned as {slope, intercept}. */
    private static double[] fitLine(double[] trend, int from, int to) {
        int count = to - from;
        double[] xs = new double[count];
        double[] ys = new double[count];
        for (int i = 0; i < count; i++) {
            xs[i] = from + i;
            ys[i] = trend[from + i];
        }
        return LinearFit.line(xs, ys);
    }
}
