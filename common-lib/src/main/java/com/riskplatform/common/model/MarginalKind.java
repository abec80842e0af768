package com.riskplatform.common.model;

/**
 * Whether a marginal model uses unconditional sample moments or a one-step-ahead
 * conditional volatility forecast.
 */
public enum MarginalKind {
    STATIC,
    CONDITIONAL
}
