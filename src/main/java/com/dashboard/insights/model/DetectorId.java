package com.dashboard.insights.model;

import java.util.Objects;

/**
 * Identifies one produced flag column: a detector applied to a metric column, or the
 * multivariate detector applied to the whole feature set (column is null).
 */
public record DetectorId(DetectorType type, String column) {

    public DetectorId {
        Objects.requireNonNull(type, "type");
        if (!type.isMultivariate() && column == null) {
            throw new IllegalArgumentException(type + " needs a metric column");
        }
    }

    public static DetectorId univariate(DetectorType type, String column) {
        return new DetectorId(type, column);
    }

    public static DetectorId multivariate(DetectorType type) {
        return new DetectorId(type, null);
    }

    public String label() {
        return column == null ? type.name() : type.name() + ":" + column;
    }

    @Override
    public String toString() {
        return label();
    }
}
