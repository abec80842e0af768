package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Simulation request. Every null field takes the configured default.
 *
 * @param includePnl when true the full PnL vector is returned
 */
public record MonteCarloRequest(
    @JsonProperty("panel") PanelPayload panel,
    @JsonProperty("weights") Map<String, Double> weights,
    @JsonProperty("seed") Long seed,
    @JsonProperty("notional") Double notional,
    @JsonProperty("scenarios") Integer scenarios,
    @JsonProperty("horizonDays") Integer horizonDays,
    @JsonProperty("lambda") Double lambda,
    @JsonProperty("nuCopula") Double nuCopula,
    @JsonProperty("nuMarginal") Double nuMarginal,
    @JsonProperty("includePnl") Boolean includePnl
) {}
