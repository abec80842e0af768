package com.riskplatform.common.stats;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Draws standard Student-t variates as {@code Z / sqrt(V / ν)} with Z normal and V chi-squared,
 * both taken from the supplied generator so a seed reproduces the sample.
 */
public final class StudentTSampler {

    private StudentTSampler() {}

    public static double[] sample(double nu, int size, RandomGenerator rng) {
        double[] out = new double[size];
        if (Double.isInfinite(nu)) {
            for (int i = 0; i < size; i++) out[i] = rng.nextGaussian();
            return out;
        }
        ChiSquaredDistribution chiSquared = new ChiSquaredDistribution(rng, nu);
        for (int i = 0; i < size; i++) {
            double z = rng.nextGaussian();
            double v = chiSquared.sample();
            out[i] = z / Math.sqrt(v / nu);
        }
        return out;
    }
}
