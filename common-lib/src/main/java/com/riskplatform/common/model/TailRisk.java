package com.riskplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * VaR and ES at a single confidence level, both signed (negative = loss).
 */
public record TailRisk(
    @JsonProperty("confidence") double confidence,
    @JsonProperty("valueAtRisk") double valueAtRisk,
    @JsonProperty("expectedShortfall") double expectedShortfall
) {}
