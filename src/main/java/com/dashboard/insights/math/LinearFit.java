package com.dashboard.insights.math;

/**
 * Simple ordinary least squares of {@code y} on the sequential index {@code 0..n-1}.
 */
public final class LinearFit {

    private final double slope;
    private final double intercept;
    private final double rSquared;

    private LinearFit(double slope, double intercept, double rSquared) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
    }

    public static LinearFit overIndex(double[] y) {
        int n = y.length;
        if (n < 2) {
            throw new IllegalArgumentException("Linear fit needs at least 2 points, got " + n);
        }
        double meanX = (n - 1) / 2.0;
        double meanY = 0.0;
        for (double v : y) meanY += v;
        meanY /= n;

        double sxy = 0.0, sxx = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            sxy += dx * (y[i] - meanY);
            sxx += dx * dx;
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssRes = 0.0, ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (intercept + slope * i);
            ssRes += residual * residual;
            double dev = y[i] - meanY;
            ssTot += dev * dev;
        }
        // Constant target: perfect fit scores 1, anything else 0
        double r2;
        if (ssTot == 0.0) {
            r2 = ssRes == 0.0 ? 1.0 : 0.0;
        } else {
            r2 = Math.max(0.0, Math.min(1.0, 1.0 - ssRes / ssTot));
        }
        return new LinearFit(slope, intercept, r2);
    }

    /**
     * Least squares line through arbitrary (x, y) pairs.
     */
    public static double[] line(double[] x, double[] y) {
        int n = x.length;
        double meanX = 0.0, meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double sxy = 0.0, sxx = 0.0;
        for (int i = 0; i < n; i++) {
            sxy += (x[i] - meanX) * (y[i] - meanY);
            sxx += (x[i] - meanX) * (x[i] - meanX);
        }
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;
        return new double[]{slope, meanY - slope * meanX};
    }

    public double predict(double index) {
        return intercept + slope * index;
    }

    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }
    public double getRSquared() { return rSquared; }
}
