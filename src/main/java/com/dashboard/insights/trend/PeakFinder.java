package com.dashboard.insights.trend;

import com.dashboard.insights.model.Extremum;

import java.util.ArrayList;
import java.util.List;

/**
 * Local maxima with topographic prominence.
 *
 * A flat plateau counts as one peak located at its middle sample (rounded down). The
 * prominence of a peak is its height above the higher of the two minima reached when
 * walking left and right until a strictly higher sample (or the series end). NaN samples
 * never form peaks and stop the walk.
 */
public final class PeakFinder {

    private PeakFinder() {}

    /**
     * @param minHeight     peaks below this value are dropped; use {@code Double.NEGATIVE_INFINITY} to keep all
     * @param minProminence peaks less prominent than this are dropped
     */
    public static List<Extremum> findPeaks(double[] x, double minHeight, double minProminence) {
        List<Extremum> peaks = new ArrayList<>();
        for (int peak : localMaxima(x)) {
            if (!(x[peak] >= minHeight)) continue;
            double prominence = prominence(x, peak);
            if (prominence >= minProminence) {
                peaks.add(new Extremum(peak, x[peak], prominence));
            }
        }
        return peaks;
    }

    /**
     * Peaks of the negated series, reported with the original values.
     */
    public static List<Extremum> findTroughs(double[] x, double minProminence) {
        double[] negated = new double[x.length];
        for (int i = 0; i < x.length; i++) negated[i] = -x[i];
        List<Extremum> troughs = new ArrayList<>();
        for (Extremum e : findPeaks(negated, Double.NEGATIVE_INFINITY, minProminence)) {
            troughs.add(new Extremum(e.index(), x[e.index()], e.prominence()));
        }
        return troughs;
    }

    static List<Integer> localMaxima(double[] x) {
        List<Integer> maxima = new ArrayList<>();
        int i = 1;
        int last = x.length - 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) {
                    ahead++;
                }
                if (x[ahead] < x[i]) {
                    int right = ahead - 1;
                    maxima.add((i + right) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return maxima;
    }

    static double prominence(double[] x, int peak) {
        double height = x[peak];

        double leftMin = height;
        for (int i = peak; i >= 0 && x[i] <= height; i--) {
            if (x[i] < leftMin) leftMin = x[i];
        }
        double rightMin = height;
        for (int i = peak; i < x.length && x[i] <= height; i++) {
            if (x[i] < rightMin) rightMin = x[i];
        }
        return height - Math.max(leftMin, rightMin);
    }
}
