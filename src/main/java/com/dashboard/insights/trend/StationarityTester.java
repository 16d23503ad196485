package com.dashboard.insights.trend;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.math.NormalDistribution;
import com.dashboard.insights.math.OlsRegression;
import com.dashboard.insights.math.SeriesStatistics;
import com.dashboard.insights.model.StationarityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Augmented Dickey-Fuller unit root test with a constant term.
 *
 * The regression is {@code dx[t] = c + g*x[t-1] + sum(a_j*dx[t-j]) + e}. The lag count is
 * chosen by minimum AIC over 0..maxLag on a common sample, then the regression is refit
 * on the longest sample for that lag. The statistic is the t-value of {@code g}.
 * P-values follow MacKinnon (1994), critical values MacKinnon (2010).
 */
@Component
public class StationarityTester {

    private static final Logger log = LoggerFactory.getLogger(StationarityTester.class);

    // MacKinnon (1994) response surface, constant only, one variable
    private static final double TAU_MAX = 2.74;
    private static final double TAU_MIN = -18.83;
    private static final double TAU_STAR = -1.61;
    private static final double[] TAU_SMALL_P = {2.1659, 1.4412, 0.038269};
    private static final double[] TAU_LARGE_P = {1.7339, 0.93202, -0.12745, -0.010368};

    // MacKinnon (2010) critical value polynomials in 1/nobs
    private static final String[] CRITICAL_LEVELS = {"1%", "5%", "10%"};
    private static final double[][] TAU_CRITICAL = {
            {-3.43035, -6.5393, -16.786, -79.433},
            {-2.86154, -2.8903, -4.234, -40.040},
            {-2.56677, -1.5384, -2.809, 0.0}
    };

    private final double significance;

    public StationarityTester(TrendConfig config) {
        this.significance = config.getStationaritySignificance();
        if (!(significance > 0 && significance < 1)) {
            throw new InvalidConfigurationException("Significance must be in (0, 1), got " + significance);
        }
    }

    public StationarityResult test(double[] x) {
        if (x.length > 0 && SeriesStatistics.isConstant(x)) {
            return StationarityResult.builder()
                    .stationary(true)
                    .pValue(0.0)
                    .degenerate(true)
                    .criticalValues(Map.of())
                    .build();
        }

        int n = x.length;
        int maxLag = (int) Math.ceil(12.0 * Math.pow(n / 100.0, 0.25));
        maxLag = Math.min(n / 2 - 2, maxLag);
        if (maxLag < 0) {
            return StationarityResult.failed("Series of " + n + " points is too short for the ADF regression");
        }

        try {
            int bestLag = selectLag(x, maxLag);
            OlsRegression fit = regress(x, bestLag, n - 1 - bestLag, false);
            double statistic = fit.tValue(0);
            int nobs = fit.getNobs();
            if (!Double.isFinite(statistic)) {
                return StationarityResult.failed("ADF statistic is undefined: the regression fits exactly");
            }
            double pValue = pValue(statistic);

            log.debug("ADF statistic={} p={} lag={} nobs={}", statistic, pValue, bestLag, nobs);
            return StationarityResult.builder()
                    .stationary(pValue < significance)
                    .adfStatistic(statistic)
                    .pValue(pValue)
                    .criticalValues(criticalValues(nobs))
                    .usedLag(bestLag)
                    .nobs(nobs)
                    .build();
        } catch (ArithmeticException e) {
            return StationarityResult.failed("ADF regression failed: " + e.getMessage());
        }
    }

    /**
     * Lag with minimum AIC, all candidates fitted on the sample left by {@code maxLag}.
     * Ties go to the smaller lag.
     */
    private int selectLag(double[] x, int maxLag) {
        int commonNobs = x.length - 1 - maxLag;
        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            double aic = regress(x, lag, commonNobs, true).aic();
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = lag;
            }
        }
        return bestLag;
    }

    /**
     * Builds and fits the ADF regression over the last {@code nobs} differences.
     * Column order is [level, lagged diffs..., const], or const first when {@code constantFirst}.
     */
    private OlsRegression regress(double[] x, int lag, int nobs, boolean constantFirst) {
        double[] dx = SeriesStatistics.diff(x);
        double[] y = new double[nobs];
        double[][] design = new double[nobs][lag + 2];
        int start = dx.length - nobs;
        for (int r = 0; r < nobs; r++) {
            int t = start + r;
            y[r] = dx[t];
            int offset = constantFirst ? 1 : 0;
            design[r][offset] = x[t];
            for (int j = 1; j <= lag; j++) {
                design[r][offset + j] = dx[t - j];
            }
            design[r][constantFirst ? 0 : lag + 1] = 1.0;
        }
        return OlsRegression.fit(y, design);
    }

    static double pValue(double statistic) {
        if (statistic > TAU_MAX) return 1.0;
        if (statistic < TAU_MIN) return 0.0;
        double[] coef = statistic <= TAU_STAR ? TAU_SMALL_P : TAU_LARGE_P;
        return NormalDistribution.cdf(polynomial(coef, statistic));
    }

    static Map<String, Double> criticalValues(int nobs) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < CRITICAL_LEVELS.length; i++) {
            values.put(CRITICAL_LEVELS[i], polynomial(TAU_CRITICAL[i], 1.0 / nobs));
        }
        return values;
    }

    private static double polynomial(double[] ascending, double x) {
        double result = 0.0;
        for (int i = ascending.length - 1; i >= 0; i--) {
            result = result * x + ascending[i];
        }
        return result;
    }
}
