package com.dashboard.insights.trend;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.math.SeriesStatistics;
import com.dashboard.insights.model.PeaksAndTroughs;
import org.springframework.stereotype.Component;

/**
 * Prominent peaks and troughs of a raw metric series.
 * Default minimum prominence is a fraction of the value range.
 */
@Component
public class PeakTroughLocator {

    private final double prominenceFraction;

    public PeakTroughLocator(TrendConfig config) {
        this.prominenceFraction = config.getPeakProminenceFraction();
        if (!(prominenceFraction >= 0)) {
            throw new InvalidConfigurationException(
                    "Peak prominence fraction must be non-negative, got " + prominenceFraction);
        }
    }

    /**
     * @param minProminence explicit minimum prominence, or null for the configured fraction of the range
     */
    public PeaksAndTroughs locate(double[] values, Double minProminence) {
        if (values.length == 0) {
            throw new InsufficientDataException("Peak detection needs at least one value", 1, 0);
        }
        if (minProminence != null && minProminence < 0) {
            throw new InvalidConfigurationException("Minimum prominence must be non-negative, got " + minProminence);
        }
        double prominence = minProminence != null
                ? minProminence
                : prominenceFraction * (SeriesStatistics.max(values) - SeriesStatistics.min(values));

        return PeaksAndTroughs.builder()
                .minProminence(prominence)
                .peaks(PeakFinder.findPeaks(values, Double.NEGATIVE_INFINITY, prominence))
                .troughs(PeakFinder.findTroughs(values, prominence))
                .build();
    }
}
