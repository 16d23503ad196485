package com.dashboard.insights.trend;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.math.SeriesStatistics;
import com.dashboard.insights.model.Extremum;
import com.dashboard.insights.model.SeasonalityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detects repeating cycles from peaks of the autocorrelation function.
 *
 * Autocorrelation at lag k is the Pearson correlation between {@code x[k..]} and
 * {@code x[..n-k]}, computed for k = 1 .. min(maxLag, n - 1). Peaks of that curve at or
 * above the minimum height are seasonal lags; the first one is the primary period.
 */
@Component
public class SeasonalityDetector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalityDetector.class);

    private final int maxLag;
    private final double minHeight;

    public SeasonalityDetector(TrendConfig config) {
        this.maxLag = config.getMaxSeasonalityLag();
        this.minHeight = config.getSeasonalityMinHeight();
        if (maxLag < 1) {
            throw new InvalidConfigurationException("Max seasonality lag must be positive, got " + maxLag);
        }
    }

    public SeasonalityResult detect(double[] values) {
        double[] acf = autocorrelation(values, Math.min(maxLag, values.length - 1));
        if (acf.length < 3) {
            return SeasonalityResult.none();
        }

        // acf[i] holds lag i + 1
        List<Integer> lags = PeakFinder.findPeaks(acf, minHeight, 0.0).stream()
                .map(Extremum::index)
                .map(i -> i + 1)
                .toList();
        if (lags.isEmpty()) {
            return SeasonalityResult.none();
        }
        log.debug("Seasonal lags found: {}", lags);
        return SeasonalityResult.builder()
                .hasSeasonality(true)
                .primaryPeriod(lags.get(0))
                .peakLags(lags)
                .build();
    }

    /**
     * @return autocorrelations for lags 1..maxLag; NaN where a slice has zero variance
     */
    public static double[] autocorrelation(double[] values, int maxLag) {
        if (maxLag < 1) return new double[0];
        double[] acf = new double[maxLag];
        for (int lag = 1; lag <= maxLag; lag++) {
            acf[lag - 1] = SeriesStatistics.correlation(values, lag, values, 0, values.length - lag);
        }
        return acf;
    }
}
