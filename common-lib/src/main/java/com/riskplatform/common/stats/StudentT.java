package com.riskplatform.common.stats;

import com.riskplatform.common.exception.NumericalDegeneracyException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * Closed-form Student-t quantities used by every parametric model.
 *
 * <h3>Expected shortfall factor</h3>
 * <pre>
 *   q          = t⁻¹(α; ν)
 *   ES-factor  = −((ν + q²) / (ν − 1)) · φ_t(q; ν) / α
 * </pre>
 * so that {@code ES(α) = μ + σ · ES-factor(α, ν)} for a location-scale t.
 *
 * <p>An infinite ν is accepted everywhere and means the Gaussian limit.
 * Pure static utility, no state.
 */
public final class StudentT {

    private static final String COMPONENT = "StudentT";
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private StudentT() {}

    /** Standard t (or normal, for infinite ν) without a sampling generator attached. */
    public static RealDistribution distribution(double nu) {
        if (Double.isInfinite(nu)) return STANDARD_NORMAL;
        if (!(nu > 0.0)) {
            throw new NumericalDegeneracyException(COMPONENT, "degrees of freedom must be positive, got " + nu);
        }
        return new TDistribution(null, nu);
    }

    public static double quantile(double alpha, double nu) {
        return distribution(nu).inverseCumulativeProbability(alpha);
    }

    public static double density(double x, double nu) {
        return distribution(nu).density(x);
    }

    /**
     * @param alpha lower-tail probability, e.g. 0.05 for 95% ES
     * @param nu    degrees of freedom, must exceed 1
     * @return ES-factor(α, ν), always at or below {@link #quantile(double, double)}
     */
    public static double esFactor(double alpha, double nu) {
        if (alpha <= 0.0 || alpha >= 1.0) {
            throw new IllegalArgumentException("alpha must lie in (0,1), got " + alpha);
        }
        if (Double.isInfinite(nu)) {
            double z = STANDARD_NORMAL.inverseCumulativeProbability(alpha);
            return -STANDARD_NORMAL.density(z) / alpha;
        }
        if (!(nu > 1.0)) {
            throw new NumericalDegeneracyException(COMPONENT,
                "expected shortfall undefined for nu=" + nu + " (requires nu > 1)");
        }
        TDistribution t = new TDistribution(null, nu);
        double q = t.inverseCumulativeProbability(alpha);
        return -((nu + q * q) / (nu - 1.0)) * (t.density(q) / alpha);
    }

    /** Standard deviation of a standard t(ν); the divisor that brings a draw to unit variance. */
    public static double standardDeviation(double nu) {
        if (Double.isInfinite(nu)) return 1.0;
        if (!(nu > 2.0)) {
            throw new NumericalDegeneracyException(COMPONENT,
                "variance undefined for nu=" + nu + " (requires nu > 2)");
        }
        return Math.sqrt(nu / (nu - 2.0));
    }
}
