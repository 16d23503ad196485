package com.dashboard.insights.engine.detectors;

import com.dashboard.insights.config.DetectionConfig;
import com.dashboard.insights.engine.UnivariateDetector;
import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.math.SeriesStatistics;
import com.dashboard.insights.model.DetectorFlag;
import com.dashboard.insights.model.DetectorId;
import com.dashboard.insights.model.DetectorOutput;
import com.dashboard.insights.model.DetectorType;
import com.dashboard.insights.model.IqrBounds;
import com.dashboard.insights.model.ObservationSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags values outside [Q1 - k*IQR, Q3 + k*IQR], quartiles taken over the full column.
 * The bounds travel with the output so the summary can explain each flag.
 *
 * Score = distance beyond the nearest bound in IQR units (raw distance when IQR is 0).
 */
@Component
public class IqrDetector implements UnivariateDetector {

    private final double multiplier;

    public IqrDetector(DetectionConfig config) {
        this.multiplier = config.getIqrMultiplier();
        if (!(multiplier >= 0)) {
            throw new InvalidConfigurationException("IQR multiplier must be non-negative, got " + multiplier);
        }
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.IQR;
    }

    @Override
    public DetectorOutput detect(ObservationSeries series) {
        double[] values = series.values();
        if (SeriesStatistics.countPresent(values) == 0) {
            throw new InsufficientDataException("Column " + series.getName() + " has no values", 1, 0);
        }

        IqrBounds bounds = IqrBounds.of(
                SeriesStatistics.quantile(values, 0.25),
                SeriesStatistics.quantile(values, 0.75),
                multiplier);

        List<DetectorFlag> flags = new ArrayList<>(values.length);
        for (double value : values) {
            if (Double.isNaN(value)) {
                flags.add(DetectorFlag.notApplicable());
                continue;
            }
            double excess = 0.0;
            if (value < bounds.lowerBound()) {
                excess = bounds.lowerBound() - value;
            } else if (value > bounds.upperBound()) {
                excess = value - bounds.upperBound();
            }
            double score = bounds.iqr() > 0 ? excess / bounds.iqr() : excess;
            flags.add(DetectorFlag.of(bounds.isOutside(value), score));
        }
        return new DetectorOutput(DetectorId.univariate(DetectorType.IQR, series.getName()), flags, bounds);
    }
}
