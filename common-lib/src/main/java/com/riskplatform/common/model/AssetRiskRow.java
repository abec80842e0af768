package com.riskplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a per-asset risk table. A failed fit keeps the asset in the table with
 * NaN figures and the failure message in {@code error}.
 */
public record AssetRiskRow(
    @JsonProperty("asset") String asset,
    @JsonProperty("kind") MarginalKind kind,
    @JsonProperty("mean") double mean,
    @JsonProperty("std") double std,
    @JsonProperty("df") double df,
    @JsonProperty("var95") double var95,
    @JsonProperty("var99") double var99,
    @JsonProperty("es95") double es95,
    @JsonProperty("es99") double es99,
    @JsonProperty("converged") boolean converged,
    @JsonProperty("error") String error
) {
    public static AssetRiskRow of(MarginalModel model) {
        RiskMeasures m = model.riskMeasures();
        return new AssetRiskRow(model.asset(), model.kind(), model.mu(), model.sigma(), model.nu(),
            m.var95(), m.var99(), m.es95(), m.es99(), model.converged(), null);
    }

    public static AssetRiskRow failed(String asset, MarginalKind kind, String error) {
        return new AssetRiskRow(asset, kind, Double.NaN, Double.NaN, Double.NaN,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN, false, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
