package com.riskplatform.common.portfolio;

import com.riskplatform.common.marginal.DegreesOfFreedomSearch;
import com.riskplatform.common.model.PortfolioRisk;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.RiskMeasures;
import com.riskplatform.common.model.RiskModel;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.common.stats.SampleStatistics;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Unconditional Student-t VaR/ES fitted directly to the realized portfolio return series.
 *
 * <p>Mean and std come from the weighted series itself, which is the same as combining
 * the full realized covariance {@code wᵀΣw}; ν comes from the KS search on that series.
 */
public final class StaticTPortfolioAggregator {

    private final DegreesOfFreedomSearch dfSearch;

    public StaticTPortfolioAggregator() {
        this(new DegreesOfFreedomSearch());
    }

    public StaticTPortfolioAggregator(DegreesOfFreedomSearch dfSearch) {
        this.dfSearch = dfSearch;
    }

    public PortfolioRisk aggregate(ReturnPanel panel, WeightVector weights, RandomGenerator rng) {
        return aggregate(panel.portfolioReturns(weights), rng);
    }

    public PortfolioRisk aggregate(double[] portfolioReturns, RandomGenerator rng) {
        double mu = SampleStatistics.mean(portfolioReturns);
        double sigma = SampleStatistics.std(portfolioReturns);
        int nu = dfSearch.estimate(portfolioReturns, rng);
        return new PortfolioRisk(RiskModel.STATIC_T, nu, mu, sigma, RiskMeasures.fromStudentT(mu, sigma, nu));
    }
}
