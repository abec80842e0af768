package com.riskplatform.common.montecarlo;

import com.riskplatform.common.model.RiskMeasures;
import com.riskplatform.common.model.TailRisk;
import com.riskplatform.common.stats.TailMeasures;

import java.util.List;

/**
 * Scenario set produced by {@link TCopulaSimulator}.
 *
 * @param settings         parameters of the run
 * @param assets           asset order of the scenario columns
 * @param weights          normalized weights used for aggregation
 * @param assetReturns     scenarios × assets horizon returns
 * @param portfolioReturns weighted horizon return per scenario
 * @param pnl              {@code notional × portfolioReturns}
 */
public record SimulationResult(
    SimulationSettings settings,
    List<String> assets,
    double[] weights,
    double[][] assetReturns,
    double[] portfolioReturns,
    double[] pnl
) {
    /** PnL VaR and CVaR at {@code confidence}, in currency. */
    public TailRisk pnlTailRisk(double confidence) {
        return TailMeasures.varCvar(pnl, confidence);
    }

    /** 95% / 99% VaR and CVaR of the simulated PnL, in currency. */
    public RiskMeasures pnlRiskMeasures() {
        return RiskMeasures.of(pnlTailRisk(0.95), pnlTailRisk(0.99));
    }

    /** 95% / 99% VaR and CVaR as signed horizon returns. */
    public RiskMeasures returnRiskMeasures() {
        return RiskMeasures.of(
            TailMeasures.varCvar(portfolioReturns, 0.95),
            TailMeasures.varCvar(portfolioReturns, 0.99));
    }
}
