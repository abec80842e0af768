package com.riskplatform.common.marginal;

import org.apache.commons.math3.special.Gamma;

/**
 * Negative log-likelihood of a constant-mean GARCH(p,q) with standardized Student-t
 * innovations, over an unconstrained parameter vector.
 *
 * <h3>Parametrization (length 4 + p + q − 1)</h3>
 * <pre>
 *   θ[0]                 μ
 *   θ[1]                 ω = exp(θ[1])
 *   θ[2]                 s = MAX_PERSISTENCE · logistic(θ[2])        total persistence
 *   θ[3 .. 3+p+q−2]      logits of the p+q shares of s (last logit fixed at 0)
 *   θ[last]              ν = NU_MIN + (NU_MAX − NU_MIN) · logistic(θ[last])
 * </pre>
 * which keeps ω &gt; 0, every coefficient non-negative, Σα + Σβ &lt; 1 and ν inside
 * (2.05, 500) without a constrained optimizer.
 */
final class GarchLikelihood {

    static final double NU_MIN = 2.05;
    static final double NU_MAX = 500.0;
    static final double MAX_PERSISTENCE = 0.9999;
    static final double PENALTY = 1e10;

    private static final int BACKCAST_WINDOW = 75;
    private static final double BACKCAST_DECAY = 0.94;

    private final double[] y;
    private final int p;
    private final int q;
    private final double backcast;

    GarchLikelihood(double[] y, int p, int q) {
        this.y = y;
        this.p = p;
        this.q = q;
        this.backcast = backcast(y);
    }

    int dimension() {
        return 3 + (p + q - 1) + 1;
    }

    /** Decoded model parameters. */
    record Params(double mu, double omega, double[] alphas, double[] betas, double nu) {}

    Params decode(double[] theta) {
        double mu = theta[0];
        double omega = Math.exp(theta[1]);
        double persistence = MAX_PERSISTENCE * logistic(theta[2]);

        int k = p + q;
        double[] weights = new double[k];
        double max = 0.0;
        for (int i = 0; i < k - 1; i++) max = Math.max(max, theta[3 + i]);
        double sum = 0.0;
        for (int i = 0; i < k; i++) {
            double z = i < k - 1 ? theta[3 + i] : 0.0;
            weights[i] = Math.exp(z - max);
            sum += weights[i];
        }
        double[] alphas = new double[p];
        double[] betas = new double[q];
        for (int i = 0; i < p; i++) alphas[i] = persistence * weights[i] / sum;
        for (int j = 0; j < q; j++) betas[j] = persistence * weights[p + j] / sum;

        double nu = NU_MIN + (NU_MAX - NU_MIN) * logistic(theta[theta.length - 1]);
        return new Params(mu, omega, alphas, betas, nu);
    }

    /** Inverse of {@link #decode}, used to build the starting point. */
    double[] encode(double mu, double omega, double[] alphas, double[] betas, double nu) {
        double[] theta = new double[dimension()];
        theta[0] = mu;
        theta[1] = Math.log(omega);
        double persistence = 0.0;
        for (double a : alphas) persistence += a;
        for (double b : betas) persistence += b;
        theta[2] = logit(persistence / MAX_PERSISTENCE);

        int k = p + q;
        double last = betas[q - 1];
        for (int i = 0; i < k - 1; i++) {
            double share = i < p ? alphas[i] : betas[i - p];
            theta[3 + i] = Math.log(share / last);
        }
        theta[theta.length - 1] = logit((nu - NU_MIN) / (NU_MAX - NU_MIN));
        return theta;
    }

    double negativeLogLikelihood(double[] theta) {
        Params params = decode(theta);
        double[] sigma2 = conditionalVariances(params);
        if (sigma2 == null) return PENALTY;

        double nu = params.nu();
        double constant = Gamma.logGamma((nu + 1.0) / 2.0) - Gamma.logGamma(nu / 2.0)
            - 0.5 * Math.log(Math.PI * (nu - 2.0));
        double ll = 0.0;
        for (int t = 0; t < y.length; t++) {
            double e = y[t] - params.mu();
            ll += constant - 0.5 * Math.log(sigma2[t])
                - 0.5 * (nu + 1.0) * Math.log1p(e * e / (sigma2[t] * (nu - 2.0)));
        }
        return Double.isFinite(ll) ? -ll : PENALTY;
    }

    /**
     * In-sample conditional variances; pre-sample lags use the backcast.
     *
     * @return null when a variance is non-positive or non-finite
     */
    double[] conditionalVariances(Params params) {
        int n = y.length;
        double[] sigma2 = new double[n];
        for (int t = 0; t < n; t++) {
            double v = params.omega();
            for (int i = 1; i <= p; i++) {
                v += params.alphas()[i - 1] * (t - i >= 0 ? squaredResidual(t - i, params.mu()) : backcast);
            }
            for (int j = 1; j <= q; j++) {
                v += params.betas()[j - 1] * (t - j >= 0 ? sigma2[t - j] : backcast);
            }
            if (!(v > 0.0) || !Double.isFinite(v)) return null;
            sigma2[t] = v;
        }
        return sigma2;
    }

    /** One-step-ahead conditional variance after the last observation. */
    double forecastVariance(Params params, double[] sigma2) {
        int n = y.length;
        double v = params.omega();
        for (int i = 1; i <= p; i++) {
            v += params.alphas()[i - 1] * (n - i >= 0 ? squaredResidual(n - i, params.mu()) : backcast);
        }
        for (int j = 1; j <= q; j++) {
            v += params.betas()[j - 1] * (n - j >= 0 ? sigma2[n - j] : backcast);
        }
        return v;
    }

    double backcast() {
        return backcast;
    }

    private double squaredResidual(int t, double mu) {
        double e = y[t] - mu;
        return e * e;
    }

    /** Exponentially weighted mean of the first squared demeaned observations. */
    private static double backcast(double[] y) {
        double mean = 0.0;
        for (double v : y) mean += v;
        mean /= y.length;
        int window = Math.min(BACKCAST_WINDOW, y.length);
        double weighted = 0.0;
        double weightSum = 0.0;
        double w = 1.0;
        for (int t = 0; t < window; t++) {
            double e = y[t] - mean;
            weighted += w * e * e;
            weightSum += w;
            w *= BACKCAST_DECAY;
        }
        return weighted / weightSum;
    }

    private static double logistic(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private static double logit(double u) {
        double clipped = Math.min(Math.max(u, 1e-12), 1.0 - 1e-12);
        return Math.log(clipped / (1.0 - clipped));
    }
}
