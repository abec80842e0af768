package com.riskplatform.common.model;

import com.riskplatform.common.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Portfolio weights aligned to a {@link ReturnPanel}'s asset order and normalized to sum to 1.
 */
public final class WeightVector {

    private static final Logger log = LoggerFactory.getLogger(WeightVector.class);
    private static final String COMPONENT = "WeightVector";

    private final List<String> assets;
    private final double[] values;

    private WeightVector(List<String> assets, double[] values) {
        this.assets = assets;
        this.values = values;
    }

    /**
     * Aligns raw weights to the panel: weights for assets the panel lacks are dropped,
     * panel assets without a weight get an explicit 0, and the result is renormalized.
     *
     * @throws InvalidInputException if the aligned weights sum to exactly zero
     */
    public static WeightVector align(ReturnPanel panel, Map<String, Double> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidInputException(COMPONENT, "no weights supplied");
        }
        List<String> dropped = new ArrayList<>();
        for (String asset : raw.keySet()) {
            if (panel.indexOf(asset) < 0) dropped.add(asset);
        }
        if (!dropped.isEmpty()) {
            log.warn("Dropping weights for assets absent from the return panel. assets={}", dropped);
        }

        List<String> assets = panel.assets();
        double[] aligned = new double[assets.size()];
        double sum = 0.0;
        for (int j = 0; j < assets.size(); j++) {
            Double w = raw.get(assets.get(j));
            aligned[j] = w == null ? 0.0 : w;
            if (!Double.isFinite(aligned[j])) {
                throw new InvalidInputException(COMPONENT, "non-finite weight for asset=" + assets.get(j));
            }
            sum += aligned[j];
        }
        if (sum == 0.0) {
            throw new InvalidInputException(COMPONENT,
                "weights sum to zero after aligning to the panel universe " + assets);
        }
        for (int j = 0; j < aligned.length; j++) aligned[j] /= sum;
        return new WeightVector(assets, aligned);
    }

    /** Equal weights over every asset in the panel. */
    public static WeightVector equal(ReturnPanel panel) {
        double[] values = new double[panel.assetCount()];
        Arrays.fill(values, 1.0 / values.length);
        return new WeightVector(panel.assets(), values);
    }

    public List<String> assets() { return assets; }

    public double[] values() { return values.clone(); }

    public double weight(int j) { return values[j]; }

    public int size() { return values.length; }
}
