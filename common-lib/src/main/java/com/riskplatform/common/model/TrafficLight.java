package com.riskplatform.common.model;

/**
 * Basel-style backtest zone for 99% VaR exception counts.
 *
 * <p>{@link #UNDEFINED}: sample too small to classify. {@link #NOT_APPLICABLE}:
 * the backtested VaR is not at 99% confidence.
 */
public enum TrafficLight {
    GREEN,
    YELLOW,
    RED,
    UNDEFINED,
    NOT_APPLICABLE
}
