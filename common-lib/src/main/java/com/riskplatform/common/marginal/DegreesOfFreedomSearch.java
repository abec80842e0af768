package com.riskplatform.common.marginal;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.stats.SampleStatistics;
import com.riskplatform.common.stats.StudentTSampler;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;

/**
 * Goodness-of-fit search for Student-t degrees of freedom.
 *
 * <p>For every integer ν in {@code [minDf, maxDf]} a same-length standard t(ν) sample is
 * drawn from the supplied generator and compared with the standardized series by the
 * two-sample Kolmogorov-Smirnov statistic. The ν with the smallest statistic wins;
 * ties go to the smaller ν.
 *
 * <p>This is not a maximum-likelihood estimate. The result depends on the generator's
 * state, so reproducibility requires pinning the seed. Candidates are drawn in
 * ascending ν order, one sample per candidate.
 */
public final class DegreesOfFreedomSearch {

    public static final int DEFAULT_MIN_DF = 3;
    public static final int DEFAULT_MAX_DF = 99;

    private static final String COMPONENT = "DegreesOfFreedomSearch";

    private final int minDf;
    private final int maxDf;

    public DegreesOfFreedomSearch() {
        this(DEFAULT_MIN_DF, DEFAULT_MAX_DF);
    }

    /**
     * @param minDf smallest candidate, must exceed 2 so variance and ES stay finite
     * @param maxDf largest candidate, at least {@code minDf}
     */
    public DegreesOfFreedomSearch(int minDf, int maxDf) {
        if (minDf <= 2) {
            throw new InvalidInputException(COMPONENT, "minimum degrees of freedom must exceed 2, got " + minDf);
        }
        if (maxDf < minDf) {
            throw new InvalidInputException(COMPONENT, "empty search range [" + minDf + ", " + maxDf + "]");
        }
        this.minDf = minDf;
        this.maxDf = maxDf;
    }

    public int estimate(double[] series, RandomGenerator rng) {
        double[] standardized = SampleStatistics.standardize(series);
        KolmogorovSmirnovTest ks = new KolmogorovSmirnovTest();
        double[] statistics = new double[maxDf - minDf + 1];
        for (int nu = minDf; nu <= maxDf; nu++) {
            double[] simulated = StudentTSampler.sample(nu, standardized.length, rng);
            statistics[nu - minDf] = ks.kolmogorovSmirnovStatistic(simulated, standardized);
        }
        return minDf + argMin(statistics);
    }

    /** Index of the smallest value; the first index wins a tie. */
    static int argMin(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[best]) best = i;
        }
        return best;
    }

    public int minDf() { return minDf; }

    public int maxDf() { return maxDf; }
}
