package com.dashboard.insights.model;

public enum TrendDirection {
    UPWARD("Upward"),
    DOWNWARD("Downward"),
    STABLE("Stable");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public static TrendDirection fromSlope(double slope, double threshold) {
        if (slope > threshold) return UPWARD;
        if (slope < -threshold) return DOWNWARD;
        return STABLE;
    }
}
