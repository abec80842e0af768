package com.riskplatform.engine.config;

import java.util.List;

/**
 * Engine defaults bound from {@code risk.*} in application.yml. Request fields override
 * the simulation and backtest values per call.
 */
public record RiskSettings(
    long seed,
    int minDf,
    int maxDf,
    int garchMinObservations,
    double garchFallbackNu,
    double ewmaLambda,
    CorrelationSource garchCorrelation,
    double notional,
    int scenarios,
    List<Integer> horizons,
    double nuCopula,
    double nuMarginal,
    double backtestConfidence,
    int backtestWindow,
    List<Integer> sweepWindows
) {
    public RiskSettings {
        horizons = List.copyOf(horizons);
        sweepWindows = List.copyOf(sweepWindows);
    }
}
