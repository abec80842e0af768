package com.riskplatform.common.marginal;

import com.riskplatform.common.exception.InvalidInputException;

/**
 * Chooses a GARCH(p,q)-t order by minimum BIC over {@code p ∈ [1, maxP]}, {@code q ∈ [1, maxQ]}.
 *
 * <p>Opt-in only: it runs {@code maxP · maxQ} full fits, so it is markedly slower than the
 * fixed (1,1) path used by {@link GarchTEstimator#fit}. Fallback fits carry no BIC and
 * are never selected unless every order falls back, in which case the (1,1) fallback
 * is returned.
 */
public final class GarchOrderSearch {

    private final GarchTEstimator estimator;
    private final int maxP;
    private final int maxQ;

    public GarchOrderSearch(GarchTEstimator estimator, int maxP, int maxQ) {
        if (maxP < 1 || maxQ < 1) {
            throw new InvalidInputException("GarchOrderSearch", "order bounds must be at least 1");
        }
        this.estimator = estimator;
        this.maxP = maxP;
        this.maxQ = maxQ;
    }

    public GarchFit search(String asset, double[] series) {
        GarchFit best = null;
        GarchFit baseline = null;
        for (int p = 1; p <= maxP; p++) {
            for (int q = 1; q <= maxQ; q++) {
                GarchFit fit = estimator.fitOrder(asset, series, p, q);
                if (p == 1 && q == 1) baseline = fit;
                if (Double.isNaN(fit.bic())) continue;
                if (best == null || fit.bic() < best.bic()) best = fit;
            }
        }
        return best != null ? best : baseline;
    }
}
