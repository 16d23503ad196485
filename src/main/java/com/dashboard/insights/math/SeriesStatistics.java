package com.dashboard.insights.math;

import java.util.Arrays;

/**
 * Descriptive statistics over {@code double[]} columns. Missing entries are encoded as NaN
 * and skipped by every method here unless stated otherwise.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static int countPresent(double[] values) {
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) count++;
        }
        return count;
    }

    public static double[] present(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }

    /**
     * Mean of the non-missing values, NaN when there are none.
     */
    public static double mean(double[] values) {
        double sum = 0.0;
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    /**
     * Standard deviation of the non-missing values.
     *
     * @param ddof delta degrees of freedom: 0 for population, 1 for sample
     */
    public static double stdDev(double[] values, int ddof) {
        double mean = mean(values);
        if (Double.isNaN(mean)) return Double.NaN;
        double m2 = 0.0;
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                double d = v - mean;
                m2 += d * d;
                n++;
            }
        }
        if (n - ddof <= 0) return Double.NaN;
        return Math.sqrt(m2 / (n - ddof));
    }

    /**
     * Quantile with linear interpolation between closest ranks (the default of most
     * dataframe libraries). NaN when no value is present.
     */
    public static double quantile(double[] values, double q) {
        double[] sorted = present(values);
        if (sorted.length == 0) return Double.NaN;
        Arrays.sort(sorted);
        return quantileOfSorted(sorted, q);
    }

    static double quantileOfSorted(double[] sorted, double q) {
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) return sorted[lower];
        double fraction = pos - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Pearson correlation between two equally sized slices, NaN if either has zero variance.
     */
    public static double correlation(double[] x, int xFrom, double[] y, int yFrom, int length) {
        if (length < 2) return Double.NaN;
        double meanX = 0.0, meanY = 0.0;
        for (int i = 0; i < length; i++) {
            meanX += x[xFrom + i];
            meanY += y[yFrom + i];
        }
        meanX /= length;
        meanY /= length;

        double sxy = 0.0, sxx = 0.0, syy = 0.0;
        for (int i = 0; i < length; i++) {
            double dx = x[xFrom + i] - meanX;
            double dy = y[yFrom + i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) return Double.NaN;
        return sxy / Math.sqrt(sxx * syy);
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            if (!Double.isNaN(v) && v < min) min = v;
        }
        return min == Double.POSITIVE_INFINITY ? Double.NaN : min;
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (!Double.isNaN(v) && v > max) max = v;
        }
        return max == Double.NEGATIVE_INFINITY ? Double.NaN : max;
    }

    /**
     * First differences; result has {@code values.length - 1} entries.
     */
    public static double[] diff(double[] values) {
        if (values.length < 2) return new double[0];
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = values[i] - values[i - 1];
        }
        return out;
    }

    public static boolean isConstant(double[] values) {
        double first = Double.NaN;
        for (double v : values) {
            if (Double.isNaN(v)) continue;
            if (Double.isNaN(first)) {
                first = v;
            } else if (v != first) {
                return false;
            }
        }
        return true;
    }
}
