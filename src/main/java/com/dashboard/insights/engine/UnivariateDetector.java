package com.dashboard.insights.engine;

import com.dashboard.insights.model.DetectorOutput;
import com.dashboard.insights.model.DetectorType;
import com.dashboard.insights.model.ObservationSeries;

/**
 * A detector that judges each value of a single metric column.
 * Implementations hold only read-only configuration and are safe to share.
 */
public interface UnivariateDetector {

    /**
     * The detector type this implementation provides.
     */
    DetectorType getDetectorType();

    /**
     * Whether this detector runs for a dataset. Sequential detectors need rows ordered by a date column.
     *
     * @param ordered true when the rows were sorted by a declared date column
     */
    default boolean appliesTo(boolean ordered) {
        return true;
    }

    /**
     * Flag every row of the column.
     *
     * @param series the metric column, missing values as NaN
     * @return one flag per row, in row order
     */
    DetectorOutput detect(ObservationSeries series);
}
