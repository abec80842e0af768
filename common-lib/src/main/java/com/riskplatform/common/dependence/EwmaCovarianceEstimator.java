package com.riskplatform.common.dependence;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.DependenceMatrix;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.stats.SampleStatistics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RiskMetrics-style exponentially weighted covariance.
 *
 * <h3>Recursion</h3>
 * <pre>
 *   S_seed = sample covariance of the first min(30, T) rows
 *   S_t    = λ · S_{t−1} + (1 − λ) · r_t r_tᵀ      for every later row
 * </pre>
 * Larger λ gives slower-decaying weights and a longer effective memory.
 */
public final class EwmaCovarianceEstimator {

    public static final double DEFAULT_LAMBDA = 0.94;
    public static final int SEED_WINDOW = 30;
    static final double STD_FLOOR = 1e-12;

    private static final String COMPONENT = "EwmaCovarianceEstimator";

    private final double lambda;

    public EwmaCovarianceEstimator() {
        this(DEFAULT_LAMBDA);
    }

    /**
     * @param lambda decay factor, strictly inside (0, 1)
     */
    public EwmaCovarianceEstimator(double lambda) {
        this.lambda = validateLambda(lambda);
    }

    public double lambda() {
        return lambda;
    }

    public DependenceMatrix estimate(ReturnPanel panel) {
        int observations = panel.observationCount();
        if (observations < 2) {
            throw new InvalidInputException(COMPONENT,
                "need at least 2 observations for an EWMA covariance, got " + observations);
        }
        double[][] rows = panel.rows();
        int n = panel.assetCount();
        int seed = Math.min(SEED_WINDOW, observations);

        double[][] s = SampleStatistics.covariance(rows, 0, seed);
        for (int t = seed; t < observations; t++) {
            double[] r = rows[t];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    s[i][j] = lambda * s[i][j] + (1.0 - lambda) * r[i] * r[j];
                }
            }
        }

        double[] vols = new double[n];
        for (int i = 0; i < n; i++) vols[i] = Math.sqrt(Math.max(s[i][i], 0.0));
        return new DependenceMatrix(panel.assets(), s, toCorrelation(s), vols);
    }

    /**
     * Scales rows and columns by inverse standard deviations; a zero-variance asset is
     * floored at {@value #STD_FLOOR} so its correlations come out as zero, not NaN.
     * The diagonal is exactly 1.
     */
    public static double[][] toCorrelation(double[][] covariance) {
        int n = covariance.length;
        double[] std = new double[n];
        for (int i = 0; i < n; i++) {
            double sd = Math.sqrt(Math.max(covariance[i][i], 0.0));
            std[i] = sd == 0.0 ? STD_FLOOR : sd;
        }
        double[][] corr = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                corr[i][j] = i == j ? 1.0 : covariance[i][j] / (std[i] * std[j]);
            }
        }
        return corr;
    }

    /**
     * Single-series EWMA volatility {@code sqrt(Σ (1 − λ) λⁱ r²_{T−i})}, most recent
     * observation weighted {@code 1 − λ}; NaN for an empty series.
     */
    public static double ewmaVolatility(double[] series, double lambda) {
        validateLambda(lambda);
        if (series.length == 0) return Double.NaN;
        double variance = 0.0;
        double weight = 1.0 - lambda;
        for (int i = series.length - 1; i >= 0; i--) {
            variance += weight * series[i] * series[i];
            weight *= lambda;
        }
        return Math.sqrt(variance);
    }

    /** {@link #ewmaVolatility} for every asset in panel order. */
    public Map<String, Double> volatilityVector(ReturnPanel panel) {
        Map<String, Double> vols = new LinkedHashMap<>();
        for (int j = 0; j < panel.assetCount(); j++) {
            vols.put(panel.assets().get(j), ewmaVolatility(panel.column(j), lambda));
        }
        return vols;
    }

    private static double validateLambda(double lambda) {
        if (!(lambda > 0.0 && lambda < 1.0)) {
            throw new InvalidInputException(COMPONENT, "lambda must lie strictly inside (0,1), got " + lambda);
        }
        return lambda;
    }
}
