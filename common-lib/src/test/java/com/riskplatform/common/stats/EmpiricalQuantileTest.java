package com.riskplatform.common.stats;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.TailRisk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmpiricalQuantileTest {

    private static double[] oneToHundred() {
        double[] v = new double[100];
        for (int i = 0; i < v.length; i++) v[i] = i + 1;
        return v;
    }

    @Nested
    @DisplayName("quantile()")
    class QuantileTests {

        @Test
        @DisplayName("interpolates linearly between order statistics")
        void linearInterpolation() {
            assertEquals(2.5, EmpiricalQuantile.quantile(new double[] {4, 1, 3, 2}, 0.5), 1e-12);
            // h = 99 · 0.05 = 4.95 → 5 + 0.95
            assertEquals(5.95, EmpiricalQuantile.quantile(oneToHundred(), 0.05), 1e-12);
        }

        @Test
        @DisplayName("endpoints return the minimum and maximum")
        void endpoints() {
            assertEquals(1.0, EmpiricalQuantile.quantile(oneToHundred(), 0.0));
            assertEquals(100.0, EmpiricalQuantile.quantile(oneToHundred(), 1.0));
        }

        @Test
        @DisplayName("empty input → NaN")
        void empty() {
            assertTrue(Double.isNaN(EmpiricalQuantile.quantile(new double[0], 0.5)));
        }

        @Test
        @DisplayName("does not reorder the caller's array")
        void inputUntouched() {
            double[] v = {3, 1, 2};
            EmpiricalQuantile.quantile(v, 0.5);
            assertArrayEquals(new double[] {3, 1, 2}, v);
        }
    }

    @Nested
    @DisplayName("TailMeasures.varCvar()")
    class TailMeasuresTests {

        @Test
        @DisplayName("95% VaR is the 5th percentile and CVaR the mean at or below it")
        void historicalFigures() {
            TailRisk r = TailMeasures.varCvar(oneToHundred(), 0.95);
            assertEquals(5.95, r.valueAtRisk(), 1e-12);
            assertEquals(3.0, r.expectedShortfall(), 1e-12);
        }

        @Test
        @DisplayName("a constant series has ES equal to VaR")
        void constantSeries() {
            TailRisk r = TailMeasures.varCvar(new double[] {-0.01, -0.01, -0.01}, 0.99);
            assertEquals(-0.01, r.valueAtRisk(), 1e-15);
            assertEquals(r.valueAtRisk(), r.expectedShortfall(), 1e-15);
        }

        @Test
        @DisplayName("empty outcomes and bad confidence are input errors")
        void invalidInput() {
            assertThrows(InvalidInputException.class, () -> TailMeasures.varCvar(new double[0], 0.95));
            assertThrows(InvalidInputException.class, () -> TailMeasures.varCvar(oneToHundred(), 1.0));
        }
    }

    @Nested
    @DisplayName("SampleStatistics")
    class SampleStatisticsTests {

        @Test
        @DisplayName("std is Bessel-corrected")
        void besselCorrected() {
            assertEquals(Math.sqrt(5.0 / 3.0), SampleStatistics.std(new double[] {1, 2, 3, 4}), 1e-12);
        }

        @Test
        @DisplayName("fewer than two observations for std or covariance is an input error")
        void tooShort() {
            assertThrows(InvalidInputException.class, () -> SampleStatistics.std(new double[] {1}));
            assertThrows(InvalidInputException.class, () -> SampleStatistics.mean(new double[0]));
            assertThrows(InvalidInputException.class,
                () -> SampleStatistics.covariance(new double[][] {{1, 2}}, 0, 1));
        }

        @Test
        @DisplayName("zero-variance series cannot be standardized")
        void zeroVariance() {
            assertThrows(InvalidInputException.class,
                () -> SampleStatistics.standardize(new double[] {2, 2, 2}));
        }
    }
}
