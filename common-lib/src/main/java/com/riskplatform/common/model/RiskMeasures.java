package com.riskplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.stats.StudentT;

/**
 * 95% and 99% VaR / ES as signed returns (fraction of notional, negative = loss),
 * or as currency amounts after {@link #scaled(double)}.
 */
public record RiskMeasures(
    @JsonProperty("var95") double var95,
    @JsonProperty("es95") double es95,
    @JsonProperty("var99") double var99,
    @JsonProperty("es99") double es99
) {
    public static final double TAIL_95 = 0.05;
    public static final double TAIL_99 = 0.01;

    public static RiskMeasures fromStudentT(double mu, double sigma, double nu) {
        return new RiskMeasures(
            mu + sigma * StudentT.quantile(TAIL_95, nu),
            mu + sigma * StudentT.esFactor(TAIL_95, nu),
            mu + sigma * StudentT.quantile(TAIL_99, nu),
            mu + sigma * StudentT.esFactor(TAIL_99, nu)
        );
    }

    public static RiskMeasures of(TailRisk at95, TailRisk at99) {
        return new RiskMeasures(at95.valueAtRisk(), at95.expectedShortfall(),
            at99.valueAtRisk(), at99.expectedShortfall());
    }

    public RiskMeasures scaled(double notional) {
        return new RiskMeasures(var95 * notional, es95 * notional, var99 * notional, es99 * notional);
    }
}
