package com.dashboard.insights.math;

/**
 * Multiple linear regression by the normal equations. Small designs only (a few dozen
 * regressors); the design matrix is passed row-major and must already contain any
 * constant column.
 */
public final class OlsRegression {

    private static final double SINGULAR_TOLERANCE = 1e-12;

    private final double[] coefficients;
    private final double[] standardErrors;
    private final double ssr;
    private final int nobs;

    private OlsRegression(double[] coefficients, double[] standardErrors, double ssr, int nobs) {
        this.coefficients = coefficients;
        this.standardErrors = standardErrors;
        this.ssr = ssr;
        this.nobs = nobs;
    }

    /**
     * @throws ArithmeticException if {@code X'X} is singular or there are no residual degrees of freedom
     */
    public static OlsRegression fit(double[] y, double[][] x) {
        int n = y.length;
        int k = x[0].length;
        if (n <= k) {
            throw new ArithmeticException("Regression needs more observations (" + n
                    + ") than regressors (" + k + ")");
        }

        double[][] xtx = new double[k][k];
        double[] xty = new double[k];
        for (int r = 0; r < n; r++) {
            double[] row = x[r];
            for (int i = 0; i < k; i++) {
                xty[i] += row[i] * y[r];
                for (int j = i; j < k; j++) {
                    xtx[i][j] += row[i] * row[j];
                }
            }
        }
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < i; j++) {
                xtx[i][j] = xtx[j][i];
            }
        }

        double[][] inverse = invert(xtx);
        double[] beta = new double[k];
        for (int i = 0; i < k; i++) {
            double s = 0.0;
            for (int j = 0; j < k; j++) s += inverse[i][j] * xty[j];
            beta[i] = s;
        }

        double ssr = 0.0;
        for (int r = 0; r < n; r++) {
            double fitted = 0.0;
            for (int i = 0; i < k; i++) fitted += x[r][i] * beta[i];
            double e = y[r] - fitted;
            ssr += e * e;
        }

        double sigma2 = ssr / (n - k);
        double[] se = new double[k];
        for (int i = 0; i < k; i++) {
            se[i] = Math.sqrt(Math.max(0.0, sigma2 * inverse[i][i]));
        }
        return new OlsRegression(beta, se, ssr, n);
    }

    /**
     * Gauss-Jordan inversion with partial pivoting.
     */
    static double[][] invert(double[][] matrix) {
        int k = matrix.length;
        double[][] a = new double[k][2 * k];
        double scale = 0.0;
        for (int i = 0; i < k; i++) {
            System.arraycopy(matrix[i], 0, a[i], 0, k);
            a[i][k + i] = 1.0;
            scale = Math.max(scale, Math.abs(matrix[i][i]));
        }
        double tolerance = SINGULAR_TOLERANCE * Math.max(scale, 1.0);

        for (int col = 0; col < k; col++) {
            int pivot = col;
            for (int r = col + 1; r < k; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) pivot = r;
            }
            if (Math.abs(a[pivot][col]) < tolerance) {
                throw new ArithmeticException("Design matrix is singular");
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;

            double p = a[col][col];
            for (int j = 0; j < 2 * k; j++) a[col][j] /= p;
            for (int r = 0; r < k; r++) {
                if (r == col) continue;
                double factor = a[r][col];
                if (factor == 0.0) continue;
                for (int j = 0; j < 2 * k; j++) a[r][j] -= factor * a[col][j];
            }
        }

        double[][] inverse = new double[k][k];
        for (int i = 0; i < k; i++) {
            System.arraycopy(a[i], k, inverse[i], 0, k);
        }
        return inverse;
    }

    public double tValue(int index) {
        return coefficients[index] / standardErrors[index];
    }

    /**
     * Gaussian log-likelihood evaluated at the least squares estimate.
     */
    public double logLikelihood() {
        return -nobs / 2.0 * (Math.log(2 * Math.PI) + Math.log(ssr / nobs) + 1.0);
    }

    public double aic() {
        return -2.0 * logLikelihood() + 2.0 * coefficients.length;
    }

    public double[] getCoefficients() { return coefficients.clone(); }
    public double[] getStandardErrors() { return standardErrors.clone(); }
    public double getSsr() { return ssr; }
    public int getNobs() { return nobs; }
}
