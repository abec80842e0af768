package com.riskplatform.common.marginal;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.MarginalKind;
import com.riskplatform.common.model.MarginalModel;
import com.riskplatform.common.stats.SampleStatistics;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Conditional Student-t marginal from a constant-mean GARCH(p,q)-t fitted by maximum
 * likelihood. The production order is (1,1); other orders are reachable through
 * {@link #fitOrder} and {@link GarchOrderSearch}.
 *
 * <h3>Numerical policy</h3>
 * <ul>
 *   <li>The series is multiplied by 1000 when its std is below 1e-4 and by 100 when
 *       below 1e-3 before fitting; forecasts are divided back.</li>
 *   <li>Fewer than {@code minObservations} points, or a zero-variance series, skip the
 *       fit and return the sample mean/std with ν = {@code fallbackNu}.</li>
 *   <li>An exhausted evaluation budget reports the best point seen; a non-finite
 *       result falls back to sample moments. Neither case throws.</li>
 * </ul>
 */
public final class GarchTEstimator implements MarginalEstimator {

    private static final Logger log = LoggerFactory.getLogger(GarchTEstimator.class);

    public static final int DEFAULT_MIN_OBSERVATIONS = 50;
    public static final double DEFAULT_FALLBACK_NU = 30.0;
    public static final int DEFAULT_MAX_EVALUATIONS = 20_000;

    private static final double START_ALPHA = 0.05;
    private static final double START_BETA = 0.90;
    private static final double START_NU = 8.0;

    private final int minObservations;
    private final double fallbackNu;
    private final int maxEvaluations;

    public GarchTEstimator() {
        this(DEFAULT_MIN_OBSERVATIONS, DEFAULT_FALLBACK_NU, DEFAULT_MAX_EVALUATIONS);
    }

    public GarchTEstimator(int minObservations, double fallbackNu, int maxEvaluations) {
        if (!(fallbackNu > 2.0)) {
            throw new InvalidInputException("GarchTEstimator", "fallback nu must exceed 2, got " + fallbackNu);
        }
        this.minObservations = Math.max(minObservations, 2);
        this.fallbackNu = fallbackNu;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public MarginalModel fit(String asset, double[] series, RandomGenerator rng) {
        GarchFit fit = fitOrder(asset, series, 1, 1);
        return new MarginalModel(asset, MarginalKind.CONDITIONAL, fit.nu(),
            fit.forecastMean(), fit.forecastStd(), fit.status() == GarchFit.Status.CONVERGED);
    }

    @Override
    public MarginalKind kind() {
        return MarginalKind.CONDITIONAL;
    }

    /**
     * Fits GARCH(p,q)-t to one series.
     *
     * @throws InvalidInputException if the series has fewer than 2 observations
     */
    public GarchFit fitOrder(String asset, double[] series, int p, int q) {
        if (p < 1 || q < 1) {
            throw new InvalidInputException("GarchTEstimator", "GARCH orders must be at least 1, got p=" + p + " q=" + q);
        }
        double mean = SampleStatistics.mean(series);
        double std = SampleStatistics.std(series);

        if (series.length < minObservations) {
            log.debug("GARCH skipped, short history. asset={} observations={} min={}",
                asset, series.length, minObservations);
            return fallback(p, q, series.length, mean, std);
        }
        if (!(std > 0.0)) {
            log.warn("GARCH skipped, zero-variance series. asset={}", asset);
            return fallback(p, q, series.length, mean, std);
        }

        double scale = scaleFactor(std);
        double[] y = new double[series.length];
        for (int t = 0; t < y.length; t++) y[t] = series[t] * scale;

        GarchLikelihood likelihood = new GarchLikelihood(y, p, q);
        double scaledVar = std * std * scale * scale;
        double[] alphas = new double[p];
        double[] betas = new double[q];
        Arrays.fill(alphas, START_ALPHA / p);
        Arrays.fill(betas, START_BETA / q);
        double omega = scaledVar * (1.0 - START_ALPHA - START_BETA);
        double[] start = likelihood.encode(mean * scale, omega, alphas, betas, START_NU);

        BestPointTracker tracker = new BestPointTracker(likelihood);
        GarchFit.Status status;
        double[] best;
        try {
            PointValuePair result = new SimplexOptimizer(1e-10, 1e-12).optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(tracker::value),
                GoalType.MINIMIZE,
                new InitialGuess(start),
                new NelderMeadSimplex(likelihood.dimension(), 0.5));
            best = result.getPoint();
            status = GarchFit.Status.CONVERGED;
        } catch (TooManyEvaluationsException e) {
            best = tracker.bestPoint();
            status = GarchFit.Status.BEST_EFFORT;
            log.warn("GARCH optimizer hit its evaluation budget, using best point seen. asset={} order=({},{}) evaluations={}",
                asset, p, q, maxEvaluations);
        }

        if (best == null || tracker.bestValue() >= GarchLikelihood.PENALTY) {
            log.warn("GARCH likelihood never finite, falling back to sample moments. asset={}", asset);
            return fallback(p, q, series.length, mean, std);
        }

        GarchLikelihood.Params params = likelihood.decode(best);
        double[] sigma2 = likelihood.conditionalVariances(params);
        double forecastVar = sigma2 == null ? Double.NaN : likelihood.forecastVariance(params, sigma2);
        if (!(forecastVar > 0.0) || !Double.isFinite(forecastVar) || !Double.isFinite(params.mu())) {
            log.warn("GARCH forecast not finite, falling back to sample moments. asset={} order=({},{})", asset, p, q);
            return fallback(p, q, series.length, mean, std);
        }

        double logLikelihood = -likelihood.negativeLogLikelihood(best);
        int k = likelihood.dimension();
        double bic = -2.0 * logLikelihood + k * Math.log(series.length);

        GarchFit fit = new GarchFit(p, q, status, params.mu() / scale, params.omega(),
            params.alphas(), params.betas(), params.nu(), logLikelihood, bic, scale,
            params.mu() / scale, Math.sqrt(forecastVar) / scale, series.length);
        log.debug("GARCH fitted. asset={} order=({},{}) status={} nu={} persistence={} sigma={}",
            asset, p, q, status, fit.nu(), fit.persistence(), fit.forecastStd());
        return fit;
    }

    /** Multiplier that lifts very small return magnitudes into a well-conditioned range. */
    static double scaleFactor(double std) {
        if (std < 1e-4) return 1000.0;
        if (std < 1e-3) return 100.0;
        return 1.0;
    }

    private GarchFit fallback(int p, int q, int observations, double mean, double std) {
        return new GarchFit(p, q, GarchFit.Status.FALLBACK, mean, Double.NaN,
            new double[p], new double[q], fallbackNu, Double.NaN, Double.NaN, 1.0,
            mean, std, observations);
    }

    /** Remembers the lowest objective value seen, for use when the budget runs out. */
    private static final class BestPointTracker {
        private final GarchLikelihood likelihood;
        private double bestValue = Double.POSITIVE_INFINITY;
        private double[] bestPoint;

        BestPointTracker(GarchLikelihood likelihood) {
            this.likelihood = likelihood;
        }

        double value(double[] theta) {
            double v = likelihood.negativeLogLikelihood(theta);
            if (v < bestValue) {
                bestValue = v;
                bestPoint = theta.clone();
            }
            return v;
        }

        double bestValue() { return bestValue; }

        double[] bestPoint() { return bestPoint; }
    }
}
