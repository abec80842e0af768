package com.riskplatform.common.marginal;

import com.riskplatform.common.model.MarginalKind;
import com.riskplatform.common.model.MarginalModel;
import com.riskplatform.common.stats.SampleStatistics;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Unconditional Student-t marginal: sample mean, Bessel-corrected sample std and a
 * KS-searched ν.
 */
public final class StaticStudentTEstimator implements MarginalEstimator {

    private final DegreesOfFreedomSearch dfSearch;

    public StaticStudentTEstimator() {
        this(new DegreesOfFreedomSearch());
    }

    public StaticStudentTEstimator(DegreesOfFreedomSearch dfSearch) {
        this.dfSearch = dfSearch;
    }

    @Override
    public MarginalModel fit(String asset, double[] series, RandomGenerator rng) {
        double mu = SampleStatistics.mean(series);
        double sigma = SampleStatistics.std(series);
        int nu = dfSearch.estimate(series, rng);
        return MarginalModel.fitted(asset, MarginalKind.STATIC, nu, mu, sigma);
    }

    @Override
    public MarginalKind kind() {
        return MarginalKind.STATIC;
    }
}
