package com.riskplatform.common.backtest;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.TrafficLight;
import com.riskplatform.common.model.VaRSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares a VaR series with realized returns. Dates where VaR is undefined are dropped
 * before any counting; an exception is a realized return strictly below VaR.
 */
public final class VarBacktester {

    private static final String COMPONENT = "VarBacktester";

    private VarBacktester() {}

    public static BacktestResult backtest(VaRSeries var, double[] realized) {
        return backtest(var, realized, var.confidence());
    }

    public static BacktestResult backtest(VaRSeries var, double[] realized, double confidence) {
        if (var.size() != realized.length) {
            throw new InvalidInputException(COMPONENT, "VaR series and realized returns differ in length: "
                + var.size() + " vs " + realized.length);
        }

        List<LocalDate> dates = new ArrayList<>();
        boolean[] mask = new boolean[var.definedCount()];
        int n = 0;
        int x = 0;
        for (int i = 0; i < realized.length; i++) {
            if (!var.isDefined(i)) continue;
            boolean breach = realized[i] < var.value(i);
            mask[n++] = breach;
            if (breach) x++;
            dates.add(var.dates().get(i));
        }
        if (n == 0) {
            throw new InvalidInputException(COMPONENT, "no observations left after dropping undefined VaR entries");
        }

        KupiecTest.Result kupiec = KupiecTest.test(mask, confidence);
        ChristoffersenTest.Independence independence = ChristoffersenTest.independence(mask);
        ChristoffersenTest.ConditionalCoverage cc = ChristoffersenTest.conditionalCoverage(kupiec, independence);
        TrafficLight zone = BaselTrafficLight.classify(n, x, confidence);

        return new BacktestResult(confidence, n, x, (double) x / n, n * (1.0 - confidence),
            dates, mask, kupiec, independence, cc, zone, BaselTrafficLight.thresholds(n, confidence));
    }

    /** Rolling historical VaR over {@code window} days, then {@link #backtest(VaRSeries, double[])}. */
    public static BacktestResult backtestHistorical(List<LocalDate> dates, double[] returns,
                                                    double confidence, int window) {
        return backtest(RollingHistoricalVar.compute(dates, returns, confidence, window), returns);
    }
}
