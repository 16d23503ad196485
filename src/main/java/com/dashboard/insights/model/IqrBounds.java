package com.dashboard.insights.model;

public record IqrBounds(double q1, double q3, double iqr, double lowerBound, double upperBound) {

    public static IqrBounds of(double q1, double q3, double multiplier) {
        double iqr = q3 - q1;
        return new IqrBounds(q1, q3, iqr, q1 - multiplier * iqr, q3 + multiplier * iqr);
    }

    public boolean isOutside(double value) {
        return value < lowerBound || value > upperBound;
    }
}
