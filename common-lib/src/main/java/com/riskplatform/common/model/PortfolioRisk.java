package com.riskplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Portfolio-level result of one methodology.
 *
 * @param model    methodology that produced the figures
 * @param nu       portfolio degrees of freedom, NaN for non-parametric models
 * @param mean     portfolio mean return used by the model, NaN when not applicable
 * @param std      portfolio standard deviation used by the model, NaN when not applicable
 * @param measures VaR/ES at 95% and 99% as signed returns
 */
public record PortfolioRisk(
    @JsonProperty("model") RiskModel model,
    @JsonProperty("nu") double nu,
    @JsonProperty("mean") double mean,
    @JsonProperty("std") double std,
    @JsonProperty("measures") RiskMeasures measures
) {}
