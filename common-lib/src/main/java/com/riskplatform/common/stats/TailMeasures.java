package com.riskplatform.common.stats;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.TailRisk;

/**
 * VaR / CVaR extraction from an outcome vector (returns or PnL, negative = loss).
 *
 * <p>For confidence α, VaR is the empirical (1 − α)-quantile, so "95% VaR" is the 5th
 * percentile. CVaR is the mean of every outcome at or below VaR and falls back to VaR
 * itself when that slice is empty.
 */
public final class TailMeasures {

    private TailMeasures() {}

    public static TailRisk varCvar(double[] outcomes, double confidence) {
        if (outcomes == null || outcomes.length == 0) {
            throw new InvalidInputException("TailMeasures", "cannot compute VaR of an empty series");
        }
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new InvalidInputException("TailMeasures", "confidence must lie in (0,1), got " + confidence);
        }
        double var = EmpiricalQuantile.quantile(outcomes, 1.0 - confidence);
        double es = EmpiricalQuantile.tailMean(outcomes, var);
        return new TailRisk(confidence, var, Double.isNaN(es) ? var : es);
    }
}
