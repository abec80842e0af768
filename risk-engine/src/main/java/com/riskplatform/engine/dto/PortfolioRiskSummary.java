package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.engine.config.CorrelationSource;

import java.util.List;

public record PortfolioRiskSummary(
    @JsonProperty("notional") double notional,
    @JsonProperty("garchCorrelation") CorrelationSource garchCorrelation,
    @JsonProperty("rows") List<PortfolioSummaryRow> rows
) {}
