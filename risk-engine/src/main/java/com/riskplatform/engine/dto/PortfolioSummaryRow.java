package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.model.RiskMeasures;
import com.riskplatform.common.model.RiskModel;

/**
 * One methodology at one horizon.
 *
 * @param measures VaR/ES as signed returns
 * @param amounts  the same figures in currency, {@code measures × notional}
 */
public record PortfolioSummaryRow(
    @JsonProperty("model") RiskModel model,
    @JsonProperty("horizonDays") int horizonDays,
    @JsonProperty("nu") double nu,
    @JsonProperty("measures") RiskMeasures measures,
    @JsonProperty("amounts") RiskMeasures amounts
) {}
