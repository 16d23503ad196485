package com.dashboard.insights.model;

import java.util.List;

/**
 * Fixed-width numeric table used by the multivariate detector.
 * Rows are time-aligned observations; entries may be NaN when missing.
 */
public final class FeatureMatrix {

    private final List<String> featureNames;
    private final double[][] rows;

    public FeatureMatrix(List<String> featureNames, double[][] rows) {
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != featureNames.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + rows[i].length
                        + " values, expected " + featureNames.size());
            }
        }
        this.featureNames = List.copyOf(featureNames);
        this.rows = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            this.rows[i] = rows[i].clone();
        }
    }

    /**
     * Builds a matrix from equally long columns.
     */
    public static FeatureMatrix fromColumns(List<ObservationSeries> columns) {
        List<String> names = columns.stream().map(ObservationSeries::getName).toList();
        int rowCount = columns.isEmpty() ? 0 : columns.get(0).size();
        double[][] rows = new double[rowCount][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            ObservationSeries column = columns.get(j);
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("Column " + column.getName() + " is not aligned");
            }
            for (int i = 0; i < rowCount; i++) {
                rows[i][j] = column.valueAt(i);
            }
        }
        return new FeatureMatrix(names, rows);
    }

    public List<String> getFeatureNames() { return featureNames; }
    public int rowCount() { return rows.length; }

    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) copy[i] = rows[i].clone();
        return copy;
    }
}
