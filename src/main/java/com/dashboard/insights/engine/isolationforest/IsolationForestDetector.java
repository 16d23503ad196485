package com.dashboard.insights.engine.isolationforest;

import com.dashboard.insights.config.DetectionConfig;
import com.dashboard.insights.engine.MultivariateDetector;
import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.math.SeriesStatistics;
import com.dashboard.insights.model.DetectorFlag;
import com.dashboard.insights.model.DetectorId;
import com.dashboard.insights.model.DetectorOutput;
import com.dashboard.insights.model.DetectorType;
import com.dashboard.insights.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Multivariate outlier detection over all metric columns.
 *
 * Missing cells are imputed to 0.0, features are standardised, and a fresh forest is
 * trained on every call. A row is flagged when its score falls below the
 * {@code contamination} quantile of all scores, so roughly that fraction of rows is flagged.
 *
 * Score = negated isolation score; lower is more anomalous.
 */
@Component
public class IsolationForestDetector implements MultivariateDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    private final double contamination;
    private final int numTrees;
    private final int maxSamples;
    private final long seed;

    public IsolationForestDetector(DetectionConfig config) {
        this.contamination = config.getContamination();
        this.numTrees = config.getNumTrees();
        this.maxSamples = config.getMaxSamples();
        this.seed = config.getRandomSeed();
        if (!(contamination > 0 && contamination < 1)) {
            throw new InvalidConfigurationException("Contamination must be in (0, 1), got " + contamination);
        }
        if (numTrees < 1) {
            throw new InvalidConfigurationException("Number of trees must be positive, got " + numTrees);
        }
        if (maxSamples < 2) {
            throw new InvalidConfigurationException("Max samples must be at least 2, got " + maxSamples);
        }
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.ISOLATION_FOREST;
    }

    @Override
    public DetectorOutput detect(FeatureMatrix features) {
        int rows = features.rowCount();
        if (rows < 2) {
            throw new InsufficientDataException("Isolation forest needs at least 2 rows", 2, rows);
        }

        double[][] data = features.toArray();
        for (double[] row : data) {
            for (int f = 0; f < row.length; f++) {
                if (Double.isNaN(row[f])) row[f] = 0.0;
            }
        }

        double[][] scaled = StandardScaler.fit(data).transform(data);
        IsolationForest forest = IsolationForest.train(scaled, numTrees, maxSamples, seed);
        double[] scores = forest.scoreSamples(scaled);
        double offset = SeriesStatistics.quantile(scores, contamination);

        List<DetectorFlag> flags = new ArrayList<>(rows);
        int flagged = 0;
        for (double score : scores) {
            boolean outlier = score < offset;
            if (outlier) flagged++;
            flags.add(DetectorFlag.of(outlier, score));
        }
        log.debug("Isolation forest over {} rows x {}: offset={}, flagged={}",
                rows, features.getFeatureNames(), offset, flagged);
        return new DetectorOutput(DetectorId.multivariate(DetectorType.ISOLATION_FOREST), flags);
    }
}
