package com.riskplatform.common.montecarlo;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One asset's share of portfolio expected shortfall.
 *
 * @param asset       asset name
 * @param weight      portfolio weight
 * @param marginalEs  mean asset return across the tail scenarios
 * @param componentEs {@code weight · marginalEs}; components sum to portfolio ES
 * @param share       {@code componentEs / ES}; shares sum to 1
 */
public record ComponentShortfallRow(
    @JsonProperty("asset") String asset,
    @JsonProperty("weight") double weight,
    @JsonProperty("marginalEs") double marginalEs,
    @JsonProperty("componentEs") double componentEs,
    @JsonProperty("share") double share
) {}
