package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.ReturnPanel;

import java.time.LocalDate;
import java.util.List;

/**
 * Wire form of a panel: either {@code returns} (one row per date) or {@code prices}
 * (one row per date, converted to log returns, first date dropped).
 */
public record PanelPayload(
    @JsonProperty("dates") List<LocalDate> dates,
    @JsonProperty("assets") List<String> assets,
    @JsonProperty("returns") double[][] returns,
    @JsonProperty("prices") double[][] prices
) {
    public ReturnPanel toReturnPanel() {
        if (returns != null && prices != null) {
            throw new InvalidInputException("PanelPayload", "send either returns or prices, not both");
        }
        if (returns != null) return ReturnPanel.of(dates, assets, returns);
        if (prices != null) return ReturnPanel.fromPrices(dates, assets, prices);
        throw new InvalidInputException("PanelPayload", "panel carries neither returns nor prices");
    }
}
