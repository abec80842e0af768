package com.riskplatform.common.stats;

import com.riskplatform.common.exception.InvalidInputException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;

/**
 * Sample moments over plain arrays. Standard deviations and covariances are
 * Bessel-corrected.
 */
public final class SampleStatistics {

    private static final String COMPONENT = "SampleStatistics";

    private SampleStatistics() {}

    public static double mean(double[] series) {
        requireObservations(series, 1);
        return StatUtils.mean(series);
    }

    public static double std(double[] series) {
        requireObservations(series, 2);
        return Math.sqrt(StatUtils.variance(series));
    }

    /**
     * Centres the series and scales it to unit sample variance.
     *
     * @throws InvalidInputException if the series has zero variance
     */
    public static double[] standardize(double[] series) {
        double mean = mean(series);
        double std = std(series);
        if (!(std > 0.0)) {
            throw new InvalidInputException(COMPONENT, "cannot standardize a zero-variance series");
        }
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            out[i] = (series[i] - mean) / std;
        }
        return out;
    }

    /**
     * Covariance of the columns of {@code rows[from, to)}.
     */
    public static double[][] covariance(double[][] rows, int from, int to) {
        int count = to - from;
        if (count < 2) {
            throw new InvalidInputException(COMPONENT,
                "need at least 2 observations for a covariance, got " + count);
        }
        double[][] window = new double[count][];
        for (int i = 0; i < count; i++) {
            window[i] = rows[from + i];
        }
        return new Covariance(window, true).getCovarianceMatrix().getData();
    }

    private static void requireObservations(double[] series, int min) {
        if (series == null || series.length < min) {
            throw new InvalidInputException(COMPONENT,
                "need at least " + min + " observation(s), got " + (series == null ? 0 : series.length));
        }
    }
}
