package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.model.AssetRiskRow;

import java.util.List;
import java.util.Map;

/**
 * Per-asset risk tables with the five riskiest and safest assets by 95% ES.
 */
public record AssetRiskReport(
    @JsonProperty("staticRows") List<AssetRiskRow> staticRows,
    @JsonProperty("garchRows") List<AssetRiskRow> garchRows,
    @JsonProperty("worstStatic") List<AssetRiskRow> worstStatic,
    @JsonProperty("bestStatic") List<AssetRiskRow> bestStatic,
    @JsonProperty("worstGarch") List<AssetRiskRow> worstGarch,
    @JsonProperty("bestGarch") List<AssetRiskRow> bestGarch,
    @JsonProperty("ewmaVolatility") Map<String, Double> ewmaVolatility
) {}
