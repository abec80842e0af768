package com.riskplatform.common.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.model.TrafficLight;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one VaR backtest over the dates where the VaR series is defined.
 *
 * @param dates              dates tested, aligned with {@code exceptions}
 * @param exceptions         true where the realized return fell below VaR
 * @param expectedExceptions {@code observations · (1 − confidence)}
 */
public record BacktestResult(
    @JsonProperty("confidence") double confidence,
    @JsonProperty("observations") int observations,
    @JsonProperty("exceptionCount") int exceptionCount,
    @JsonProperty("exceptionRate") double exceptionRate,
    @JsonProperty("expectedExceptions") double expectedExceptions,
    @JsonProperty("dates") List<LocalDate> dates,
    @JsonProperty("exceptions") boolean[] exceptions,
    @JsonProperty("kupiec") KupiecTest.Result kupiec,
    @JsonProperty("independence") ChristoffersenTest.Independence independence,
    @JsonProperty("conditionalCoverage") ChristoffersenTest.ConditionalCoverage conditionalCoverage,
    @JsonProperty("zone") TrafficLight zone,
    @JsonProperty("thresholds") BaselTrafficLight.Thresholds thresholds
) {}
