package com.riskplatform.common.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Christoffersen independence and conditional-coverage tests.
 *
 * <p>Independence compares an i.i.d. Bernoulli model of the exception indicator with a
 * first-order Markov chain. When either row of the transition table is empty (the
 * process never leaves one state) or fewer than two observations exist the test is
 * undefined: statistic and p-value are NaN, counts are still reported.
 */
public final class ChristoffersenTest {

    private ChristoffersenTest() {}

    public record Independence(
        @JsonProperty("n00") int n00,
        @JsonProperty("n01") int n01,
        @JsonProperty("n10") int n10,
        @JsonProperty("n11") int n11,
        @JsonProperty("pi01") double pi01,
        @JsonProperty("pi11") double pi11,
        @JsonProperty("statistic") double statistic,
        @JsonProperty("pValue") double pValue
    ) {
        public boolean isDefined() {
            return !Double.isNaN(statistic);
        }
    }

    public record ConditionalCoverage(
        @JsonProperty("statistic") double statistic,
        @JsonProperty("pValue") double pValue
    ) {}

    public static Independence independence(boolean[] exceptions) {
        if (exceptions.length < 2) {
            return new Independence(0, 0, 0, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }

        int n00 = 0, n01 = 0, n10 = 0, n11 = 0;
        for (int t = 1; t < exceptions.length; t++) {
            boolean prev = exceptions[t - 1];
            boolean curr = exceptions[t];
            if (!prev && !curr) n00++;
            else if (!prev) n01++;
            else if (!curr) n10++;
            else n11++;
        }

        int n0 = n00 + n01;
        int n1 = n10 + n11;
        if (n0 == 0 || n1 == 0) {
            return new Independence(n00, n01, n10, n11, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }

        double pi01 = (double) n01 / n0;
        double pi11 = (double) n11 / n1;
        double pi = (double) (n01 + n11) / (n0 + n1);

        double c01 = KupiecTest.clip(pi01);
        double c11 = KupiecTest.clip(pi11);
        double c = KupiecTest.clip(pi);

        double restricted = n0 * Math.log(1.0 - c) + n1 * Math.log(c);
        double unrestricted = n00 * Math.log(1.0 - c01) + n01 * Math.log(c01)
            + n10 * Math.log(1.0 - c11) + n11 * Math.log(c11);
        double lr = -2.0 * (restricted - unrestricted);
        return new Independence(n00, n01, n10, n11, pi01, pi11, lr, KupiecTest.chiSquaredPValue(lr, 1));
    }

    /** LR_cc = LR_pof + LR_ind ~ χ²(2); NaN when independence is undefined. */
    public static ConditionalCoverage conditionalCoverage(KupiecTest.Result pof, Independence ind) {
        if (!ind.isDefined()) {
            return new ConditionalCoverage(Double.NaN, Double.NaN);
        }
        double lr = pof.statistic() + ind.statistic();
        return new ConditionalCoverage(lr, KupiecTest.chiSquaredPValue(lr, 2));
    }
}
