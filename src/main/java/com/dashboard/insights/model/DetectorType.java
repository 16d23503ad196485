package com.dashboard.insights.model;

public enum DetectorType {
    ZSCORE("Z-Score", false),
    IQR("Interquartile Range", false),
    MOVING_AVERAGE("Moving Average Deviation", false),
    ISOLATION_FOREST("Isolation Forest", true);

    private final String displayName;
    private final boolean multivariate;

    DetectorType(String displayName, boolean multivariate) {
        this.displayName = displayName;
        this.multivariate = multivariate;
    }

    public String getDisplayName() { return displayName; }
    public boolean isMultivariate() { return multivariate; }
}
