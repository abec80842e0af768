package com.riskplatform.common.dependence;

/**
 * Hook applied to a correlation matrix before it is Cholesky-factorized.
 *
 * <p>The engine never repairs an ill-conditioned matrix on its own: with
 * {@link #NONE} a non-positive-definite input fails fast. Callers that need to
 * proceed plug in a regularizer such as {@link #shrinkTowardIdentity(double)}.
 */
@FunctionalInterface
public interface CorrelationRegularizer {

    CorrelationRegularizer NONE = correlation -> correlation;

    double[][] apply(double[][] correlation);

    /**
     * {@code (1 − δ)·C + δ·I}: off-diagonals shrink toward zero, the diagonal stays 1.
     *
     * @param intensity δ in [0, 1]
     */
    static CorrelationRegularizer shrinkTowardIdentity(double intensity) {
        if (intensity < 0.0 || intensity > 1.0) {
            throw new IllegalArgumentException("shrinkage intensity must lie in [0,1], got " + intensity);
        }
        return correlation -> {
            int n = correlation.length;
            double[][] out = new double[n][n];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    out[i][j] = i == j ? 1.0 : (1.0 - intensity) * correlation[i][j];
                }
            }
            return out;
        };
    }
}
