package com.dashboard.insights.model;

import com.dashboard.insights.exception.InvalidConfigurationException;

public record ArimaOrder(int p, int d, int q) {

    public ArimaOrder {
        if (p < 0 || d < 0 || q < 0) {
            throw new InvalidConfigurationException(
                    String.format("ARIMA order must be non-negative, got (%d,%d,%d)", p, d, q));
        }
    }

    @Override
    public String toString() {
        return "(" + p + "," + d + "," + q + ")";
    }
}
