package com.dashboard.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "insights.detection")
public class DetectionConfig {

    // |z| above this flags a value
    private double zscoreThreshold = 3.0;

    // k in [Q1 - k*IQR, Q3 + k*IQR]
    private double iqrMultiplier = 1.5;

    // Trailing window (including the current row) for the moving-average detector
    private int movingAverageWindow = 7;

    // Rolling std multiplier for the moving-average detector
    private double movingAverageThreshold = 2.0;

    // Isolation forest: expected share of anomalous rows, in (0, 1)
    private double contamination = 0.05;

    private int numTrees = 100;

    // Sub-sampling size per tree, capped at the row count
    private int maxSamples = 256;

    private long randomSeed = 42L;
}
