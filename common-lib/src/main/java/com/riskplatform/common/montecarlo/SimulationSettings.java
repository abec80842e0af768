package com.riskplatform.common.montecarlo;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.exception.InvalidInputException;

/**
 * Parameters of one t-copula simulation run.
 *
 * @param notional    currency amount the portfolio return is multiplied by
 * @param scenarios   number of independent scenarios, at least 1
 * @param horizonDays holding period; vol scales by √h and drift by h
 * @param lambda      EWMA decay for the covariance, inside (0,1)
 * @param nuCopula    tail weight of the dependence structure; infinite means Gaussian copula
 * @param nuMarginal  tail weight of every margin, above 2; infinite means normal margins
 */
public record SimulationSettings(
    @JsonProperty("notional") double notional,
    @JsonProperty("scenarios") int scenarios,
    @JsonProperty("horizonDays") int horizonDays,
    @JsonProperty("lambda") double lambda,
    @JsonProperty("nuCopula") double nuCopula,
    @JsonProperty("nuMarginal") double nuMarginal
) {
    private static final String COMPONENT = "SimulationSettings";

    public SimulationSettings {
        if (scenarios < 1) {
            throw new InvalidInputException(COMPONENT, "scenario count must be positive, got " + scenarios);
        }
        if (horizonDays < 1) {
            throw new InvalidInputException(COMPONENT, "horizon must be at least 1 day, got " + horizonDays);
        }
        if (!(lambda > 0.0 && lambda < 1.0)) {
            throw new InvalidInputException(COMPONENT, "lambda must lie strictly inside (0,1), got " + lambda);
        }
        if (!(nuCopula > 0.0)) {
            throw new InvalidInputException(COMPONENT, "copula degrees of freedom must be positive, got " + nuCopula);
        }
        if (!(nuMarginal > 2.0)) {
            throw new InvalidInputException(COMPONENT,
                "marginal degrees of freedom must exceed 2 for unit-variance scaling, got " + nuMarginal);
        }
        if (!Double.isFinite(notional)) {
            throw new InvalidInputException(COMPONENT, "notional must be finite");
        }
    }
}
