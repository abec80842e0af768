package com.riskplatform.common.portfolio;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.MarginalModel;
import com.riskplatform.common.model.PortfolioRisk;
import com.riskplatform.common.model.RiskMeasures;
import com.riskplatform.common.model.RiskModel;
import com.riskplatform.common.model.WeightVector;

import java.util.List;

/**
 * Conditional portfolio VaR/ES from per-asset GARCH-t forecasts and a static correlation.
 *
 * <pre>
 *   Σ    = D · Corr · D,   D = diag(σ_i conditional)
 *   μ_p  = Σ w_i μ_i
 *   σ_p  = sqrt(wᵀ Σ w)
 *   ν_p  = Σ |w_i| ν_i / Σ |w_i|
 * </pre>
 *
 * <p>ν_p is an approximation: a weighted sum of Student-t variables is not itself
 * Student-t, so the portfolio tail weight is a heuristic blend of the marginal ones.
 */
public final class GarchTPortfolioAggregator {

    private static final String COMPONENT = "GarchTPortfolioAggregator";

    /**
     * @param weights     portfolio weights in panel order
     * @param conditional conditional marginal models, same order as the weights
     * @param correlation N×N correlation in the same order
     */
    public PortfolioRisk aggregate(WeightVector weights, List<MarginalModel> conditional, double[][] correlation) {
        int n = weights.size();
        if (conditional.size() != n || correlation.length != n) {
            throw new InvalidInputException(COMPONENT, "expected " + n + " marginals and an " + n + "x" + n
                + " correlation, got " + conditional.size() + " and " + correlation.length);
        }
        double[] w = weights.values();
        for (int i = 0; i < n; i++) {
            if (!conditional.get(i).asset().equals(weights.assets().get(i))) {
                throw new InvalidInputException(COMPONENT, "marginal order does not match weights at index " + i);
            }
        }

        double mu = 0.0;
        double variance = 0.0;
        double absWeightSum = 0.0;
        double weightedNu = 0.0;
        for (int i = 0; i < n; i++) {
            MarginalModel mi = conditional.get(i);
            mu += w[i] * mi.mu();
            absWeightSum += Math.abs(w[i]);
            weightedNu += Math.abs(w[i]) * mi.nu();
            for (int j = 0; j < n; j++) {
                variance += w[i] * w[j] * mi.sigma() * correlation[i][j] * conditional.get(j).sigma();
            }
        }
        double sigma = Math.sqrt(Math.max(variance, 0.0));
        double nu = weightedNu / absWeightSum;
        return new PortfolioRisk(RiskModel.GARCH_T, nu, mu, sigma, RiskMeasures.fromStudentT(mu, sigma, nu));
    }
}
