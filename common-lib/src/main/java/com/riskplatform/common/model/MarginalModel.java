package com.riskplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.exception.NumericalDegeneracyException;
import com.riskplatform.common.stats.StudentT;

/**
 * Location-scale Student-t description of one asset's next-day return.
 *
 * @param asset     asset name
 * @param kind      static (unconditional) or conditional (GARCH forecast)
 * @param nu        degrees of freedom, strictly greater than 2
 * @param mu        location (mean or conditional mean forecast)
 * @param sigma     scale (sample std or conditional std forecast)
 * @param converged false when a conditional fit fell back to unconditional moments
 */
public record MarginalModel(
    @JsonProperty("asset") String asset,
    @JsonProperty("kind") MarginalKind kind,
    @JsonProperty("nu") double nu,
    @JsonProperty("mu") double mu,
    @JsonProperty("sigma") double sigma,
    @JsonProperty("converged") boolean converged
) {
    public MarginalModel {
        if (!(nu > 2.0)) {
            throw new NumericalDegeneracyException("MarginalModel",
                "degrees of freedom must exceed 2 for asset=" + asset + ", got " + nu);
        }
    }

    public static MarginalModel fitted(String asset, MarginalKind kind, double nu, double mu, double sigma) {
        return new MarginalModel(asset, kind, nu, mu, sigma, true);
    }

    /** Signed VaR at lower-tail probability {@code alpha}: {@code μ + σ·t⁻¹(α; ν)}. */
    public double valueAtRisk(double alpha) {
        return mu + sigma * StudentT.quantile(alpha, nu);
    }

    /** Signed ES at lower-tail probability {@code alpha}: {@code μ + σ·ES-factor(α, ν)}. */
    public double expectedShortfall(double alpha) {
        return mu + sigma * StudentT.esFactor(alpha, nu);
    }

    public RiskMeasures riskMeasures() {
        return RiskMeasures.fromStudentT(mu, sigma, nu);
    }
}
