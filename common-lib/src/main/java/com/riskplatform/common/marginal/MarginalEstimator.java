package com.riskplatform.common.marginal;

import com.riskplatform.common.model.MarginalKind;
import com.riskplatform.common.model.MarginalModel;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Fits a per-asset Student-t marginal from one return series.
 *
 * <p>Implementations are pure functions of their arguments: no shared state, no
 * hidden generator. Callers that want parallelism dispatch one call per asset.
 */
public interface MarginalEstimator {

    /**
     * @param asset  asset name carried into the result
     * @param series the asset's daily log returns, oldest first
     * @param rng    generator for any stochastic step; ignored by deterministic estimators
     */
    MarginalModel fit(String asset, double[] series, RandomGenerator rng);

    MarginalKind kind();
}
