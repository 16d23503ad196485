package com.dashboard.insights.engine.isolationforest;

/**
 * Per-feature standardisation to zero mean and unit (population) variance.
 * Features with zero variance keep a scale of 1.
 */
public final class StandardScaler {

    private final double[] means;
    private final double[] scales;

    private StandardScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static StandardScaler fit(double[][] data) {
        int features = data.length == 0 ? 0 : data[0].length;
        double[] means = new double[features];
        double[] scales = new double[features];
        for (int f = 0; f < features; f++) {
            double sum = 0.0;
            for (double[] row : data) sum += row[f];
            double mean = sum / data.length;
            double m2 = 0.0;
            for (double[] row : data) {
                double d = row[f] - mean;
                m2 += d * d;
            }
            double std = Math.sqrt(m2 / data.length);
            means[f] = mean;
            scales[f] = std > 0 ? std : 1.0;
        }
        return new StandardScaler(means, scales);
    }

    public double[][] transform(double[][] data) {
        double[][] out = new double[data.length][];
        for (int r = 0; r < data.length; r++) {
            double[] row = new double[means.length];
            for (int f = 0; f < means.length; f++) {
                row[f] = (data[r][f] - means[f]) / scales[f];
            }
            out[r] = row;
        }
        return out;
    }
}
