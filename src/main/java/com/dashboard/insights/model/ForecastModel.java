package com.dashboard.insights.model;

public enum ForecastModel {
    LINEAR_TREND("Linear Trend"),
    EXPONENTIAL_SMOOTHING("Exponential Smoothing"),
    ARIMA("ARIMA");

    private final String displayName;

    ForecastModel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }
}
