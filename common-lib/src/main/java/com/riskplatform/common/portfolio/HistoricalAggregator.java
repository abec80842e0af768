package com.riskplatform.common.portfolio;

import com.riskplatform.common.model.PortfolioRisk;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.RiskMeasures;
import com.riskplatform.common.model.RiskModel;
import com.riskplatform.common.model.TailRisk;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.common.stats.TailMeasures;

/**
 * Non-parametric VaR/ES: the empirical tail quantile of realized portfolio returns and
 * the mean of every return at or below it. No distributional assumption, so results
 * degrade with short or non-stationary histories.
 */
public final class HistoricalAggregator {

    public PortfolioRisk aggregate(ReturnPanel panel, WeightVector weights) {
        return aggregate(panel.portfolioReturns(weights));
    }

    public PortfolioRisk aggregate(double[] portfolioReturns) {
        RiskMeasures measures = RiskMeasures.of(
            tailRisk(portfolioReturns, 1.0 - RiskMeasures.TAIL_95),
            tailRisk(portfolioReturns, 1.0 - RiskMeasures.TAIL_99));
        return new PortfolioRisk(RiskModel.HISTORICAL, Double.NaN, Double.NaN, Double.NaN, measures);
    }

    /**
     * VaR and ES at {@code confidence} (e.g. 0.95 uses the 5th percentile).
     */
    public static TailRisk tailRisk(double[] values, double confidence) {
        return TailMeasures.varCvar(values, confidence);
    }
}
