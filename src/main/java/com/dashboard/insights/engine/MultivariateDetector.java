package com.dashboard.insights.engine;

import com.dashboard.insights.model.DetectorOutput;
import com.dashboard.insights.model.DetectorType;
import com.dashboard.insights.model.FeatureMatrix;

/**
 * A detector that judges each row across all metric columns at once.
 * Any fitted state must be local to a {@link #detect} call.
 */
public interface MultivariateDetector {

    DetectorType getDetectorType();

    DetectorOutput detect(FeatureMatrix features);
}
