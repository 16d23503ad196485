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
import com.dashboard.insights.model.ObservationSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flags values whose absolute z-score exceeds the threshold.
 *
 * Mean and standard deviation are taken over the non-missing values of the whole column,
 * with the population formula (ddof = 0). Missing values are not applicable. When the
 * column has zero variance every row is not applicable: no z-score exists.
 *
 * Score = |z|.
 */
@Component
public class ZScoreDetector implements UnivariateDetector {

    private static final Logger log = LoggerFactory.getLogger(ZScoreDetector.class);

    private final double threshold;

    public ZScoreDetector(DetectionConfig config) {
        this.threshold = config.getZscoreThreshold();
        if (!(threshold > 0)) {
            throw new InvalidConfigurationException("Z-score threshold must be positive, got " + threshold);
        }
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.ZSCORE;
    }

    @Override
    public DetectorOutput detect(ObservationSeries series) {
        DetectorId id = DetectorId.univariate(DetectorType.ZSCORE, series.getName());
        double[] values = series.values();
        if (SeriesStatistics.countPresent(values) == 0) {
            throw new InsufficientDataException("Column " + series.getName() + " has no values", 1, 0);
        }

        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.stdDev(values, 0);
        if (!(std > 0) || SeriesStatistics.isConstant(values)) {
            log.debug("Column {} has zero variance; z-score undefined for all {} rows", series.getName(), values.length);
            return new DetectorOutput(id, Collections.nCopies(values.length, DetectorFlag.notApplicable()));
        }

        List<DetectorFlag> flags = new ArrayList<>(values.length);
        for (double value : values) {
            if (Double.isNaN(value)) {
                flags.add(DetectorFlag.notApplicable());
                continue;
            }
            double z = Math.abs((value - mean) / std);
            flags.add(DetectorFlag.of(z > threshold, z));
        }
        return new DetectorOutput(id, flags);
    }
}
