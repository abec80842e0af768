package com.riskplatform.common.montecarlo;

import com.riskplatform.common.dependence.CorrelationRegularizer;
import com.riskplatform.common.dependence.EwmaCovarianceEstimator;
import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.DependenceMatrix;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.common.stats.SampleStatistics;
import com.riskplatform.common.stats.StudentT;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Monte Carlo portfolio PnL with a Student-t copula and Student-t margins.
 *
 * <h3>Per run</h3>
 * <ol>
 *   <li>EWMA covariance → vols and correlation; regularizer; Cholesky factor L
 *       (a non-positive-definite correlation fails the run).</li>
 *   <li>All standard normals (scenarios × N) are drawn first, then one χ²(ν_c) per
 *       scenario; {@code Z = (N·Lᵀ) / sqrt(χ² / ν_c)}.</li>
 *   <li>{@code X = F⁻¹_{t(ν_m)}(F_{t(ν_c)}(Z))}, skipped when ν_c = ν_m because the
 *       composition is then the identity.</li>
 *   <li>{@code r = μ·h + X / sd(t(ν_m)) · vol·√h} per asset, μ the sample mean.</li>
 *   <li>Portfolio return {@code r·w}; PnL {@code notional · r·w}.</li>
 * </ol>
 *
 * <p>Cost is O(scenarios · N²), dominated by the correlating multiply. The simulator
 * keeps no state between runs; the generator is the only source of randomness.
 */
public final class TCopulaSimulator {

    private static final double U_MIN = Double.MIN_NORMAL;
    private static final double U_MAX = 1.0 - 0x1.0p-53;

    private final CorrelationRegularizer regularizer;

    public TCopulaSimulator() {
        this(CorrelationRegularizer.NONE);
    }

    public TCopulaSimulator(CorrelationRegularizer regularizer) {
        this.regularizer = regularizer;
    }

    public SimulationResult simulate(ReturnPanel panel, WeightVector weights,
                                     SimulationSettings settings, RandomGenerator rng) {
        if (!weights.assets().equals(panel.assets())) {
            throw new InvalidInputException("TCopulaSimulator",
                "weight vector assets " + weights.assets() + " do not match panel assets " + panel.assets());
        }
        DependenceMatrix dependence = new EwmaCovarianceEstimator(settings.lambda()).estimate(panel);
        double[][] l = DependenceMatrix.choleskyFactor(regularizer.apply(dependence.correlation()));

        int n = panel.assetCount();
        int scenarios = settings.scenarios();
        double[] vols = dependence.vols();
        double[] means = new double[n];
        for (int j = 0; j < n; j++) means[j] = SampleStatistics.mean(panel.column(j));

        double[][] z = correlatedNormals(rng, l, scenarios, n);
        applyChiSquaredMixing(rng, z, settings.nuCopula());
        double[][] x = remapMargins(z, settings.nuCopula(), settings.nuMarginal());

        double horizon = settings.horizonDays();
        double sqrtHorizon = Math.sqrt(horizon);
        double marginalSd = StudentT.standardDeviation(settings.nuMarginal());
        double[] w = weights.values();

        double[] portfolio = new double[scenarios];
        double[] pnl = new double[scenarios];
        for (int s = 0; s < scenarios; s++) {
            double[] row = x[s];
            double sum = 0.0;
            for (int j = 0; j < n; j++) {
                row[j] = means[j] * horizon + (row[j] / marginalSd) * vols[j] * sqrtHorizon;
                sum += row[j] * w[j];
            }
            portfolio[s] = sum;
            pnl[s] = settings.notional() * sum;
        }
        return new SimulationResult(settings, panel.assets(), w, x, portfolio, pnl);
    }

    /** Standard normal draws, row-by-row, multiplied by Lᵀ. */
    private static double[][] correlatedNormals(RandomGenerator rng, double[][] l, int scenarios, int n) {
        double[][] raw = new double[scenarios][n];
        for (int s = 0; s < scenarios; s++) {
            for (int j = 0; j < n; j++) raw[s][j] = rng.nextGaussian();
        }
        double[][] out = new double[scenarios][n];
        for (int s = 0; s < scenarios; s++) {
            double[] in = raw[s];
            double[] row = out[s];
            for (int i = 0; i < n; i++) {
                double acc = 0.0;
                double[] li = l[i];
                for (int k = 0; k <= i; k++) acc += in[k] * li[k];
                row[i] = acc;
            }
        }
        return out;
    }

    private static void applyChiSquaredMixing(RandomGenerator rng, double[][] z, double nuCopula) {
        if (Double.isInfinite(nuCopula)) return;
        ChiSquaredDistribution chiSquared = new ChiSquaredDistribution(rng, nuCopula);
        double[] divisors = new double[z.length];
        for (int s = 0; s < z.length; s++) {
            divisors[s] = Math.sqrt(chiSquared.sample() / nuCopula);
        }
        for (int s = 0; s < z.length; s++) {
            double[] row = z[s];
            for (int j = 0; j < row.length; j++) row[j] /= divisors[s];
        }
    }

    /** Copula factors → uniforms → marginal quantiles; in place when ν_c = ν_m. */
    private static double[][] remapMargins(double[][] z, double nuCopula, double nuMarginal) {
        if (nuCopula == nuMarginal) return z;
        RealDistribution copula = StudentT.distribution(nuCopula);
        RealDistribution marginal = StudentT.distribution(nuMarginal);
        for (double[] row : z) {
            for (int j = 0; j < row.length; j++) {
                double u = Math.min(Math.max(copula.cumulativeProbability(row[j]), U_MIN), U_MAX);
                row[j] = marginal.inverseCumulativeProbability(u);
            }
        }
        return z;
    }
}
