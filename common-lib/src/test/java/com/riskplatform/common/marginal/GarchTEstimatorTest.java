package com.riskplatform.common.marginal;

import com.riskplatform.common.SyntheticPanels;
import com.riskplatform.common.model.MarginalKind;
import com.riskplatform.common.model.MarginalModel;
import com.riskplatform.common.stats.SampleStatistics;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class GarchTEstimatorTest {

    @Nested
    @DisplayName("fallback policy")
    class FallbackTests {

        @Test
        @DisplayName("fewer than 50 observations → sample mean/std with ν = 30, not converged")
        void shortHistory() {
            double[] series = SyntheticPanels.independentT(40, 1, 5, 0.01, 3).column(0);
            MarginalModel model = new GarchTEstimator().fit("A1", series, new Well19937c(1));

            assertEquals(MarginalKind.CONDITIONAL, model.kind());
            assertEquals(30.0, model.nu());
            assertEquals(SampleStatistics.mean(series), model.mu(), 1e-15);
            assertEquals(SampleStatistics.std(series), model.sigma(), 1e-15);
            assertFalse(model.converged());
        }

        @Test
        @DisplayName("zero-variance series falls back instead of throwing")
        void zeroVariance() {
            double[] flat = new double[120];
            Arrays.fill(flat, 0.5);
            GarchFit fit = new GarchTEstimator().fitOrder("FLAT", flat, 1, 1);
            assertEquals(GarchFit.Status.FALLBACK, fit.status());
            assertEquals(0.0, fit.forecastStd());
            assertTrue(Double.isNaN(fit.bic()));
        }

        @Test
        @DisplayName("fits compare by value and keep their coefficient arrays private")
        void valueSemantics() {
            double[] series = SyntheticPanels.garchPath(300, 2e-6, 0.08, 0.90, 6, 13)[0];
            GarchTEstimator estimator = new GarchTEstimator(50, 30, 400);
            GarchFit fit = estimator.fitOrder("A1", series, 1, 1);
            assertEquals(fit, estimator.fitOrder("A1", series, 1, 1));

            double persistence = fit.persistence();
            fit.alphas()[0] = 5.0;
            fit.betas()[0] = 5.0;
            assertEquals(persistence, fit.persistence());
        }

        @Test
        @DisplayName("a tiny evaluation budget reports a best-effort fit, never an exception")
        void exhaustedBudget() {
            double[] series = SyntheticPanels.garchPath(600, 2e-6, 0.08, 0.90, 6, 9)[0];
            GarchFit fit = new GarchTEstimator(50, 30, 40).fitOrder("A1", series, 1, 1);
            assertNotEquals(GarchFit.Status.CONVERGED, fit.status());
            assertTrue(fit.forecastStd() > 0.0);
        }
    }

    @Nested
    @DisplayName("scaleFactor()")
    class ScaleTests {

        @Test
        @DisplayName("×1000 below 1bp std, ×100 below 10bp, otherwise 1")
        void thresholds() {
            assertEquals(1000.0, GarchTEstimator.scaleFactor(5e-5));
            assertEquals(100.0, GarchTEstimator.scaleFactor(5e-4));
            assertEquals(1.0, GarchTEstimator.scaleFactor(0.01));
        }
    }

    @Nested
    @TestInstance(TestInstance.Lifecycle.PER_CLASS)
    @DisplayName("fit on a simulated GARCH(1,1)-t path")
    class SimulatedPathTests {

        private double[] series;
        private double trueNextSigma;
        private GarchFit fit;

        @BeforeAll
        void fitOnce() {
            double[][] path = SyntheticPanels.garchPath(2000, 2e-6, 0.08, 0.90, 6, 2024);
            series = path[0];
            trueNextSigma = path[1][0];
            fit = new GarchTEstimator().fitOrder("SIM", series, 1, 1);
        }

        @Test
        @DisplayName("produces a real fit with a stationary persistence")
        void realFit() {
            assertNotEquals(GarchFit.Status.FALLBACK, fit.status());
            assertTrue(fit.persistence() > 0.5 && fit.persistence() < 1.0, "persistence=" + fit.persistence());
            assertTrue(Double.isFinite(fit.bic()));
        }

        @Test
        @DisplayName("one-step σ forecast tracks the true conditional σ")
        void forecastNearTruth() {
            double ratio = fit.forecastStd() / trueNextSigma;
            assertTrue(ratio > 0.6 && ratio < 1.6, "ratio=" + ratio);
        }

        @Test
        @DisplayName("innovation ν is fat-tailed rather than near-Gaussian")
        void fatTails() {
            assertTrue(fit.nu() > 2.05 && fit.nu() < 30, "nu=" + fit.nu());
        }

        @Test
        @DisplayName("sub-basis-point rescaling gives the same σ in original units")
        void rescaledSeries() {
            double[] tiny = new double[series.length];
            for (int t = 0; t < tiny.length; t++) tiny[t] = series[t] / 200.0;
            GarchFit scaled = new GarchTEstimator().fitOrder("TINY", tiny, 1, 1);

            assertEquals(1000.0, scaled.scale());
            double ratio = scaled.forecastStd() * 200.0 / fit.forecastStd();
            assertEquals(1.0, ratio, 0.25);
        }
    }

    @Nested
    @DisplayName("GarchOrderSearch")
    class OrderSearchTests {

        @Test
        @DisplayName("selects the lowest finite BIC among the candidate orders")
        void picksMinimumBic() {
            double[] series = SyntheticPanels.garchPath(800, 2e-6, 0.08, 0.90, 6, 77)[0];
            GarchTEstimator estimator = new GarchTEstimator();
            GarchFit best = new GarchOrderSearch(estimator, 2, 1).search("SIM", series);

            GarchFit g11 = estimator.fitOrder("SIM", series, 1, 1);
            GarchFit g21 = estimator.fitOrder("SIM", series, 2, 1);
            assertEquals(Math.min(g11.bic(), g21.bic()), best.bic(), 1e-9);
        }

        @Test
        @DisplayName("returns the (1,1) fallback when every order falls back")
        void allFallback() {
            double[] series = SyntheticPanels.independentT(30, 1, 5, 0.01, 1).column(0);
            GarchFit fit = new GarchOrderSearch(new GarchTEstimator(), 2, 2).search("SHORT", series);
            assertEquals(GarchFit.Status.FALLBACK, fit.status());
            assertEquals(1, fit.p());
            assertEquals(1, fit.q());
        }
    }
}
