package com.dashboard.insights.trend;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.math.LinearFit;
import com.dashboard.insights.model.GrowthMetrics;
import com.dashboard.insights.model.TrendDirection;
import org.springframework.stereotype.Component;

/**
 * Direction, smoothed level and growth figures of a gap-free metric series.
 */
@Component
public class TrendCharacterizer {

    /** Points per year for daily data; also the CAGR exponent base. */
    static final int PERIODS_PER_YEAR = 365;

    private final double slopeThreshold;
    private final int movingAverageWindow;

    public TrendCharacterizer(TrendConfig config) {
        this.slopeThreshold = config.getSlopeThreshold();
        this.movingAverageWindow = config.getMovingAverageWindow();
        if (!(slopeThreshold >= 0)) {
            throw new InvalidConfigurationException("Slope threshold must be non-negative, got " + slopeThreshold);
        }
        if (movingAverageWindow < 1) {
            throw new InvalidConfigurationException("Moving average window must be positive, got " + movingAverageWindow);
        }
    }

    public TrendLine direction(double[] values) {
        if (values.length < 2) {
            throw new InsufficientDataException("Trend direction needs at least 2 points", 2, values.length);
        }
        LinearFit fit = LinearFit.overIndex(values);
        return new TrendLine(TrendDirection.fromSlope(fit.getSlope(), slopeThreshold),
                fit.getSlope(), fit.getIntercept(), fit.getRSquared());
    }

    /**
     * Mean of the last {@code window} points, null when the series is shorter.
     */
    public Double movingAverage(double[] values) {
        if (values.length < movingAverageWindow) {
            return null;
        }
        double sum = 0.0;
        for (int i = values.length - movingAverageWindow; i < values.length; i++) {
            sum += values[i];
        }
        return sum / movingAverageWindow;
    }

    public GrowthMetrics growth(double[] values) {
        int n = values.length;
        if (n == 0) {
            throw new InsufficientDataException("Growth metrics need at least one point", 1, 0);
        }
        double first = values[0];
        double last = values[n - 1];

        Double mom = n >= 2 ? percentChange(values[n - 2], last) : null;
        Double yoy = n >= PERIODS_PER_YEAR ? percentChange(values[n - PERIODS_PER_YEAR], last) : null;

        Double cagr = null;
        if (n >= PERIODS_PER_YEAR && first > 0) {
            double years = (double) n / PERIODS_PER_YEAR;
            cagr = (Math.pow(last / first, 1.0 / years) - 1.0) * 100.0;
            if (!Double.isFinite(cagr)) cagr = null;
        }

        double sum = 0.0;
        int defined = 0;
        for (int i = 1; i < n; i++) {
            Double change = percentChange(values[i - 1], values[i]);
            if (change != null) {
                sum += change;
                defined++;
            }
        }

        return GrowthMetrics.builder()
                .momGrowth(mom)
                .yoyGrowth(yoy)
                .cagr(cagr)
                .avgGrowthRate(defined == 0 ? null : sum / defined)
                .currentValue(last)
                .startValue(first)
                .build();
    }

    private static Double percentChange(double base, double value) {
        if (base == 0.0 || Double.isNaN(base) || Double.isNaN(value)) {
            return null;
        }
        return (value - base) / base * 100.0;
    }
}
