package com.riskplatform.common.model;

import com.riskplatform.common.exception.InvalidInputException;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable T×N panel of daily log returns: one row per date, one column per asset.
 *
 * <p>Rows are strictly ordered by date, every row carries a finite value for every
 * asset, and the asset universe is fixed for the lifetime of the panel. Accessors
 * hand out copies so no estimator can mutate the shared input.
 */
public final class ReturnPanel {

    private static final String COMPONENT = "ReturnPanel";

    private final List<LocalDate> dates;
    private final List<String> assets;
    private final double[][] returns;

    private ReturnPanel(List<LocalDate> dates, List<String> assets, double[][] returns) {
        this.dates = dates;
        this.assets = assets;
        this.returns = returns;
    }

    /**
     * @param dates   one entry per row, strictly increasing
     * @param assets  column names, unique
     * @param returns row-major log returns, {@code returns[t][j]} for date t and asset j
     */
    public static ReturnPanel of(List<LocalDate> dates, List<String> assets, double[][] returns) {
        if (assets == null || assets.isEmpty()) {
            throw new InvalidInputException(COMPONENT, "panel has no assets");
        }
        if (returns == null || returns.length == 0) {
            throw new InvalidInputException(COMPONENT, "panel has no observations");
        }
        if (dates == null || dates.size() != returns.length) {
            throw new InvalidInputException(COMPONENT, "expected " + returns.length + " dates, got "
                + (dates == null ? 0 : dates.size()));
        }
        Set<String> seen = new HashSet<>();
        for (String asset : assets) {
            if (asset == null || !seen.add(asset)) {
                throw new InvalidInputException(COMPONENT, "duplicate or null asset name: " + asset);
            }
        }
        for (int t = 1; t < dates.size(); t++) {
            if (!dates.get(t).isAfter(dates.get(t - 1))) {
                throw new InvalidInputException(COMPONENT, "dates must be strictly increasing at row " + t);
            }
        }
        int n = assets.size();
        double[][] copy = new double[returns.length][];
        for (int t = 0; t < returns.length; t++) {
            double[] row = returns[t];
            if (row == null || row.length != n) {
                throw new InvalidInputException(COMPONENT, "row " + t + " does not have " + n + " values");
            }
            for (int j = 0; j < n; j++) {
                if (!Double.isFinite(row[j])) {
                    throw new InvalidInputException(COMPONENT,
                        "non-finite return for asset=" + assets.get(j) + " on " + dates.get(t));
                }
            }
            copy[t] = row.clone();
        }
        return new ReturnPanel(List.copyOf(dates), List.copyOf(assets), copy);
    }

    /**
     * Builds log returns {@code ln(p_t / p_{t−1})} from a price panel. The first
     * price date has no return and is dropped.
     */
    public static ReturnPanel fromPrices(List<LocalDate> dates, List<String> assets, double[][] prices) {
        if (prices == null || prices.length < 2) {
            throw new InvalidInputException(COMPONENT, "need at least 2 price rows to form returns");
        }
        if (dates == null || dates.size() != prices.length) {
            throw new InvalidInputException(COMPONENT, "expected " + prices.length + " price dates");
        }
        int n = assets == null ? 0 : assets.size();
        for (int t = 0; t < prices.length; t++) {
            if (prices[t] == null || prices[t].length != n) {
                throw new InvalidInputException(COMPONENT, "price row " + t + " does not have " + n + " values");
            }
        }
        double[][] returns = new double[prices.length - 1][n];
        for (int t = 1; t < prices.length; t++) {
            for (int j = 0; j < n; j++) {
                double prev = prices[t - 1][j];
                double curr = prices[t][j];
                if (!(prev > 0.0) || !(curr > 0.0)) {
                    throw new InvalidInputException(COMPONENT,
                        "non-positive price for asset=" + assets.get(j) + " near " + dates.get(t));
                }
                returns[t - 1][j] = Math.log(curr / prev);
            }
        }
        return of(dates.subList(1, dates.size()), assets, returns);
    }

    public int observationCount() { return returns.length; }

    public int assetCount() { return assets.size(); }

    public List<LocalDate> dates() { return dates; }

    public List<String> assets() { return assets; }

    public int indexOf(String asset) { return assets.indexOf(asset); }

    public double value(int t, int j) { return returns[t][j]; }

    public double[] column(int j) {
        double[] out = new double[returns.length];
        for (int t = 0; t < returns.length; t++) out[t] = returns[t][j];
        return out;
    }

    public double[][] rows() {
        double[][] out = new double[returns.length][];
        for (int t = 0; t < returns.length; t++) out[t] = returns[t].clone();
        return out;
    }

    /** Weighted portfolio return per date, {@code r_p,t = Σ w_j r_t,j}. */
    public double[] portfolioReturns(WeightVector weights) {
        if (!weights.assets().equals(assets)) {
            throw new InvalidInputException(COMPONENT, "weight vector is not aligned to this panel");
        }
        double[] w = weights.values();
        double[] out = new double[returns.length];
        for (int t = 0; t < returns.length; t++) {
            double sum = 0.0;
            for (int j = 0; j < w.length; j++) sum += w[j] * returns[t][j];
            out[t] = sum;
        }
        return out;
    }
}
