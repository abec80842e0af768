package com.riskplatform.common.montecarlo;

import com.riskplatform.common.stats.EmpiricalQuantile;

import java.util.ArrayList;
import java.util.List;

/**
 * Euler allocation of expected shortfall across assets from a scenario set.
 *
 * <pre>
 *   tail   = { s : r_p,s ≤ q_{1−c}(r_p) }
 *   ES     = mean over tail of r_p,s
 *   MES_i  = mean over tail of r_i,s
 *   CES_i  = w_i · MES_i              Σ CES_i = ES
 * </pre>
 *
 * <p>Shares are {@code CES_i / ES}; when ES is exactly zero (a flat scenario set) every
 * share is 0.
 */
public final class ComponentExpectedShortfall {

    private ComponentExpectedShortfall() {}

    public static List<ComponentShortfallRow> decompose(SimulationResult result, double confidence) {
        double[] portfolio = result.portfolioReturns();
        double[][] returns = result.assetReturns();
        double cutoff = EmpiricalQuantile.quantile(portfolio, 1.0 - confidence);

        int n = result.assets().size();
        double[] tailSums = new double[n];
        double tailPortfolio = 0.0;
        int count = 0;
        for (int s = 0; s < portfolio.length; s++) {
            if (portfolio[s] > cutoff) continue;
            count++;
            tailPortfolio += portfolio[s];
            for (int j = 0; j < n; j++) tailSums[j] += returns[s][j];
        }

        double es = tailPortfolio / count;
        List<ComponentShortfallRow> rows = new ArrayList<>(n);
        for (int j = 0; j < n; j++) {
            double w = result.weights()[j];
            double mes = tailSums[j] / count;
            double ces = w * mes;
            rows.add(new ComponentShortfallRow(result.assets().get(j), w, mes, ces, es == 0.0 ? 0.0 : ces / es));
        }
        return rows;
    }
}
