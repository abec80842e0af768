package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param seed KS search seed; the configured default when null
 */
public record AssetRiskRequest(
    @JsonProperty("panel") PanelPayload panel,
    @JsonProperty("seed") Long seed
) {}
