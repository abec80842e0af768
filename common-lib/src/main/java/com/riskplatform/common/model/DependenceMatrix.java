package com.riskplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskplatform.common.exception.NumericalDegeneracyException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Covariance, correlation and per-asset volatilities estimated at the last panel date.
 *
 * @param assets      asset order shared by every row and column
 * @param covariance  N×N covariance of daily returns
 * @param correlation N×N correlation with unit diagonal
 * @param vols        square roots of the covariance diagonal
 */
public record DependenceMatrix(
    @JsonProperty("assets") List<String> assets,
    @JsonProperty("covariance") double[][] covariance,
    @JsonProperty("correlation") double[][] correlation,
    @JsonProperty("vols") double[] vols
) {
    public DependenceMatrix {
        assets = List.copyOf(assets);
        covariance = deepCopy(covariance);
        correlation = deepCopy(correlation);
        vols = vols.clone();
    }

    @Override
    public double[][] covariance() { return deepCopy(covariance); }

    @Override
    public double[][] correlation() { return deepCopy(correlation); }

    @Override
    public double[] vols() { return vols.clone(); }

    /**
     * Lower-triangular L with {@code L·Lᵀ = correlation}.
     *
     * @throws NumericalDegeneracyException when the correlation is not positive definite;
     *         callers that need to proceed must regularize the matrix first
     */
    @JsonIgnore
    public double[][] choleskyFactor() {
        return choleskyFactor(correlation);
    }

    public static double[][] choleskyFactor(double[][] matrix) {
        RealMatrix m = MatrixUtils.createRealMatrix(matrix);
        try {
            return new CholeskyDecomposition(m).getL().getData();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            throw new NumericalDegeneracyException("DependenceMatrix",
                "correlation matrix is not positive definite; regularize or shrink it before simulating", e);
        }
    }

    @JsonIgnore
    public int size() {
        return assets.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependenceMatrix other)) return false;
        return assets.equals(other.assets)
            && Arrays.deepEquals(covariance, other.covariance)
            && Arrays.deepEquals(correlation, other.correlation)
            && Arrays.equals(vols, other.vols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assets, Arrays.deepHashCode(covariance),
            Arrays.deepHashCode(correlation), Arrays.hashCode(vols));
    }

    @Override
    public String toString() {
        return "DependenceMatrix[assets=" + assets + ", vols=" + Arrays.toString(vols)
            + ", correlation=" + Arrays.deepToString(correlation) + "]";
    }

    private static double[][] deepCopy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) out[i] = m[i].clone();
        return out;
    }
}
