package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * @param weights   asset → weight; renormalized after alignment with the panel
 * @param seed      seed for the KS search and the simulation; configured default when null
 * @param scenarios Monte Carlo scenario count; configured default when null
 */
public record PortfolioRiskRequest(
    @JsonProperty("panel") PanelPayload panel,
    @JsonProperty("weights") Map<String, Double> weights,
    @JsonProperty("seed") Long seed,
    @JsonProperty("scenarios") Integer scenarios
) {}
