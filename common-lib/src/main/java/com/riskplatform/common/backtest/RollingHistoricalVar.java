package com.riskplatform.common.backtest;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.VaRSeries;
import com.riskplatform.common.stats.EmpiricalQuantile;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Rolling historical VaR: the estimate for date t is the (1 − confidence)-quantile
 * of the {@code window} returns strictly before t. The first {@code window} entries
 * are NaN.
 */
public final class RollingHistoricalVar {

    private static final String COMPONENT = "RollingHistoricalVar";

    private RollingHistoricalVar() {}

    public static VaRSeries compute(List<LocalDate> dates, double[] returns, double confidence, int window) {
        if (window < 1) {
            throw new InvalidInputException(COMPONENT, "window must be at least 1, got " + window);
        }
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new InvalidInputException(COMPONENT, "confidence must lie in (0, 1), got " + confidence);
        }
        if (dates.size() != returns.length) {
            throw new InvalidInputException(COMPONENT, "dates and returns differ in length: "
                + dates.size() + " vs " + returns.length);
        }

        double tail = 1.0 - confidence;
        double[] values = new double[returns.length];
        Arrays.fill(values, Double.NaN);
        for (int t = window; t < returns.length; t++) {
            values[t] = EmpiricalQuantile.quantile(Arrays.copyOfRange(returns, t - window, t), tail);
        }
        return new VaRSeries(dates, values, confidence);
    }
}
