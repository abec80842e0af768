package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Historical-VaR backtest of the weighted portfolio. {@code window} is used by a single
 * backtest, {@code windows} by a sweep; null fields take the configured defaults.
 */
public record BacktestRequest(
    @JsonProperty("panel") PanelPayload panel,
    @JsonProperty("weights") Map<String, Double> weights,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("window") Integer window,
    @JsonProperty("windows") List<Integer> windows
) {}
