package com.riskplatform.common.stats;

import java.util.Arrays;

/**
 * Empirical quantiles with linear interpolation between order statistics
 * ({@code h = (n − 1) · p}), and the tail mean used for historical expected shortfall.
 */
public final class EmpiricalQuantile {

    private EmpiricalQuantile() {}

    public static double quantile(double[] values, double p) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return quantileOfSorted(sorted, p);
    }

    static double quantileOfSorted(double[] sorted, double p) {
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("probability must lie in [0,1], got " + p);
        }
        int n = sorted.length;
        double h = (n - 1) * p;
        int lo = (int) Math.floor(h);
        if (lo >= n - 1) return sorted[n - 1];
        double frac = h - lo;
        return sorted[lo] + frac * (sorted[lo + 1] - sorted[lo]);
    }

    /** Mean of all values at or below {@code threshold}; NaN when none qualify. */
    public static double tailMean(double[] values, double threshold) {
        double sum = 0.0;
        int count = 0;
        for (double v : values) {
            if (v <= threshold) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }
}
