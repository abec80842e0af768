package com.riskplatform.engine.config;

/** Correlation matrix fed to the GARCH-t portfolio aggregator. */
public enum CorrelationSource {
    EWMA,
    SAMPLE
}
