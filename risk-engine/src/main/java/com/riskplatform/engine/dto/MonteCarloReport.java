package com.riskplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.model.RiskMeasures;
import com.riskplatform.common.montecarlo.ComponentShortfallRow;
import com.riskplatform.common.montecarlo.SimulationSettings;

import java.util.List;

/**
 * @param returns    VaR/CVaR of the horizon portfolio return
 * @param pnl        VaR/CVaR of the simulated PnL in currency
 * @param components 95% ES split across assets
 * @param pnlVector  full PnL vector, present only when requested
 */
public record MonteCarloReport(
    @JsonProperty("settings") SimulationSettings settings,
    @JsonProperty("seed") long seed,
    @JsonProperty("returns") RiskMeasures returns,
    @JsonProperty("pnl") RiskMeasures pnl,
    @JsonProperty("components") List<ComponentShortfallRow> components,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("pnlVector") double[] pnlVector
) {}
