package com.riskplatform.common.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.exception.InvalidInputException;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;

/**
 * Kupiec proportion-of-failures test.
 *
 * <p>H0: the exception probability equals {@code 1 − confidence}.
 * <pre>
 *   LR = −2 [ x·ln(p0) + (n−x)·ln(1−p0) − x·ln(π̂) − (n−x)·ln(1−π̂) ]   ~ χ²(1)
 * </pre>
 * with π̂ = x/n clipped to [ε, 1−ε] before taking logs.
 */
public final class KupiecTest {

    static final double EPSILON = 1e-10;

    private KupiecTest() {}

    public record Result(
        @JsonProperty("observations") int observations,
        @JsonProperty("exceptions") int exceptions,
        @JsonProperty("exceptionRate") double exceptionRate,
        @JsonProperty("statistic") double statistic,
        @JsonProperty("pValue") double pValue
    ) {}

    public static Result test(boolean[] exceptions, double confidence) {
        int n = exceptions.length;
        if (n == 0) {
            throw new InvalidInputException("KupiecTest", "no observations to test");
        }
        int x = 0;
        for (boolean e : exceptions) if (e) x++;

        double rate = (double) x / n;
        double p0 = 1.0 - confidence;
        double clipped = clip(rate);

        double restricted = x * Math.log(p0) + (n - x) * Math.log(1.0 - p0);
        double unrestricted = x * Math.log(clipped) + (n - x) * Math.log(1.0 - clipped);
        double lr = -2.0 * (restricted - unrestricted);
        return new Result(n, x, rate, lr, chiSquaredPValue(lr, 1));
    }

    static double clip(double p) {
        return Math.min(Math.max(p, EPSILON), 1.0 - EPSILON);
    }

    static double chiSquaredPValue(double statistic, int degreesOfFreedom) {
        if (Double.isNaN(statistic)) return Double.NaN;
        // LR can dip a hair below zero from rounding; the upper tail is then 1.
        if (statistic <= 0.0) return 1.0;
        return 1.0 - new ChiSquaredDistribution(null, degreesOfFreedom).cumulativeProbability(statistic);
    }
}
