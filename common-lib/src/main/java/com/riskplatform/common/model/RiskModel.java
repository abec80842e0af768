package com.riskplatform.common.model;

/**
 * Portfolio VaR/ES methodologies offered by the engine.
 */
public enum RiskModel {
    STATIC_T,
    GARCH_T,
    HISTORICAL,
    MONTE_CARLO
}
