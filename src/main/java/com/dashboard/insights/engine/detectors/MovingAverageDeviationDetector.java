package com.dashboard.insights.engine.detectors;

import com.dashboard.insights.config.DetectionConfig;
import com.dashboard.insights.engine.UnivariateDetector;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.model.DetectorFlag;
import com.dashboard.insights.model.DetectorId;
import com.dashboard.insights.model.DetectorOutput;
import com.dashboard.insights.model.DetectorType;
import com.dashboard.insights.model.ObservationSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags values that deviate from their trailing moving average by more than
 * {@code threshold} rolling standard deviations.
 *
 * The window is non-centered and ends at the current row, so the first {@code window - 1}
 * rows (and any row whose window holds a missing value) are not applicable.
 * Rolling std uses the sample formula (ddof = 1).
 *
 * Only runs when rows are ordered by a date column.
 */
@Component
public class MovingAverageDeviationDetector implements UnivariateDetector {

    private final int window;
    private final double threshold;

    public MovingAverageDeviationDetector(DetectionConfig config) {
        this.window = config.getMovingAverageWindow();
        this.threshold = config.getMovingAverageThreshold();
        if (window < 2) {
            throw new InvalidConfigurationException("Moving average window must be at least 2, got " + window);
        }
        if (!(threshold > 0)) {
            throw new InvalidConfigurationException("Moving average threshold must be positive, got " + threshold);
        }
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.MOVING_AVERAGE;
    }

    @Override
    public boolean appliesTo(boolean ordered) {
        return ordered;
    }

    @Override
    public DetectorOutput detect(ObservationSeries series) {
        double[] values = series.values();
        List<DetectorFlag> flags = new ArrayList<>(values.length);

        for (int i = 0; i < values.length; i++) {
            if (i < window - 1 || Double.isNaN(values[i])) {
                flags.add(DetectorFlag.notApplicable());
                continue;
            }

            double sum = 0.0;
            boolean complete = true;
            for (int j = i - window + 1; j <= i; j++) {
                if (Double.isNaN(values[j])) {
                    complete = false;
                    break;
                }
                sum += values[j];
            }
            if (!complete) {
                flags.add(DetectorFlag.notApplicable());
                continue;
            }

            double mean = sum / window;
            double m2 = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                double d = values[j] - mean;
                m2 += d * d;
            }
            double std = Math.sqrt(m2 / (window - 1));
            double deviation = Math.abs(values[i] - mean);

            if (std == 0.0) {
                flags.add(DetectorFlag.of(false, 0.0));
            } else {
                flags.add(DetectorFlag.of(deviation > threshold * std, deviation / std));
            }
        }
        return new DetectorOutput(DetectorId.univariate(DetectorType.MOVING_AVERAGE, series.getName()), flags);
    }
}
