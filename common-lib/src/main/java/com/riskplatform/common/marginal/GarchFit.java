package com.riskplatform.common.marginal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of one GARCH(p,q)-t fit, in the units of the original return series.
 *
 * @param p               lag order of squared innovations
 * @param q               lag order of conditional variances
 * @param status          whether the optimizer converged, stopped at its budget, or was skipped
 * @param mu              constant conditional mean
 * @param omega           variance intercept (in scaled units, see {@code scale})
 * @param alphas          ARCH coefficients, length p
 * @param betas           GARCH coefficients, length q
 * @param nu              Student-t innovation degrees of freedom
 * @param logLikelihood   maximized log-likelihood on the scaled series, NaN for a fallback
 * @param bic             Bayesian information criterion, NaN for a fallback
 * @param scale           factor the series was multiplied by before fitting
 * @param forecastMean    one-step-ahead conditional mean
 * @param forecastStd     one-step-ahead conditional standard deviation
 * @param observations    series length
 */
public record GarchFit(
    @JsonProperty("p") int p,
    @JsonProperty("q") int q,
    @JsonProperty("status") Status status,
    @JsonProperty("mu") double mu,
    @JsonProperty("omega") double omega,
    @JsonProperty("alphas") double[] alphas,
    @JsonProperty("betas") double[] betas,
    @JsonProperty("nu") double nu,
    @JsonProperty("logLikelihood") double logLikelihood,
    @JsonProperty("bic") double bic,
    @JsonProperty("scale") double scale,
    @JsonProperty("forecastMean") double forecastMean,
    @JsonProperty("forecastStd") double forecastStd,
    @JsonProperty("observations") int observations
) {
    public GarchFit {
        alphas = alphas.clone();
        betas = betas.clone();
    }

    @Override
    public double[] alphas() { return alphas.clone(); }

    @Override
    public double[] betas() { return betas.clone(); }

    public enum Status {
        /** Optimizer met its convergence criterion. */
        CONVERGED,
        /** Evaluation budget exhausted; the best point seen is reported. */
        BEST_EFFORT,
        /** No usable fit; unconditional sample moments with a generic ν. */
        FALLBACK
    }

    public double persistence() {
        double sum = 0.0;
        for (double a : alphas) sum += a;
        for (double b : betas) sum += b;
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GarchFit other)) return false;
        return p == other.p && q == other.q && status == other.status
            && observations == other.observations
            && Double.compare(mu, other.mu) == 0
            && Double.compare(omega, other.omega) == 0
            && Arrays.equals(alphas, other.alphas)
            && Arrays.equals(betas, other.betas)
            && Double.compare(nu, other.nu) == 0
            && Double.compare(logLikelihood, other.logLikelihood) == 0
            && Double.compare(bic, other.bic) == 0
            && Double.compare(scale, other.scale) == 0
            && Double.compare(forecastMean, other.forecastMean) == 0
            && Double.compare(forecastStd, other.forecastStd) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, q, status, mu, omega, Arrays.hashCode(alphas), Arrays.hashCode(betas),
            nu, logLikelihood, bic, scale, forecastMean, forecastStd, observations);
    }

    @Override
    public String toString() {
        return "GarchFit[p=" + p + ", q=" + q + ", status=" + status + ", mu=" + mu + ", omega=" + omega
            + ", alphas=" + Arrays.toString(alphas) + ", betas=" + Arrays.toString(betas) + ", nu=" + nu
            + ", bic=" + bic + ", scale=" + scale + ", forecastStd=" + forecastStd + "]";
    }
}
