package com.riskplatform.common.backtest;

import com.riskplatform.common.SyntheticPanels;
import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.TrafficLight;
import com.riskplatform.common.model.VaRSeries;
import com.riskplatform.common.stats.EmpiricalQuantile;
import com.riskplatform.common.stats.StudentT;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BacktestTest {

    private static boolean[] exceptionsAt(int n, int... indices) {
        boolean[] mask = new boolean[n];
        for (int i : indices) mask[i] = true;
        return mask;
    }

    @Nested
    @DisplayName("RollingHistoricalVar")
    class RollingVarTests {

        private final double[] returns = SyntheticPanels.independentT(300, 1, 5, 0.01, 6).column(0);
        private final List<LocalDate> dates = SyntheticPanels.businessDays(300);

        @Test
        @DisplayName("defined exactly from index = window onward, NaN before")
        void sentinelBeforeWindow() {
            VaRSeries var = RollingHistoricalVar.compute(dates, returns, 0.99, 60);
            for (int t = 0; t < var.size(); t++) {
                assertEquals(t >= 60, var.isDefined(t), "index " + t);
            }
            assertEquals(240, var.definedCount());
        }

        @Test
        @DisplayName("estimate for t uses returns[t − window, t), excluding t itself")
        void excludesCurrentObservation() {
            VaRSeries var = RollingHistoricalVar.compute(dates, returns, 0.95, 50);
            double expected = EmpiricalQuantile.quantile(Arrays.copyOfRange(returns, 150, 200), 1.0 - 0.95);
            assertEquals(expected, var.value(200), 0.0);
        }

        @Test
        @DisplayName("series compare by value and hand out copies of their values")
        void valueSemantics() {
            VaRSeries first = RollingHistoricalVar.compute(dates, returns, 0.99, 60);
            VaRSeries second = RollingHistoricalVar.compute(dates, returns, 0.99, 60);
            assertEquals(first, second);
            assertEquals(first.hashCode(), second.hashCode());

            double before = first.value(100);
            first.values()[100] = 42.0;
            assertEquals(before, first.value(100));
        }

        @Test
        @DisplayName("window below 1 is an input error")
        void badWindow() {
            assertThrows(InvalidInputException.class, () -> RollingHistoricalVar.compute(dates, returns, 0.99, 0));
        }
    }

    @Nested
    @DisplayName("KupiecTest")
    class KupiecTests {

        @Test
        @DisplayName("observed rate equal to nominal → LR ≈ 0 and p-value ≈ 1")
        void nominalRate() {
            KupiecTest.Result r = KupiecTest.test(exceptionsAt(100, 3, 20, 41, 60, 99), 0.95);
            assertEquals(0.0, r.statistic(), 1e-9);
            assertEquals(1.0, r.pValue(), 1e-6);
            assertEquals(0.05, r.exceptionRate(), 1e-15);
        }

        @Test
        @DisplayName("10 exceptions in 250 days at 99% → LR 12.955")
        void knownValue() {
            boolean[] mask = exceptionsAt(250, 1, 30, 60, 90, 120, 150, 180, 200, 220, 240);
            KupiecTest.Result r = KupiecTest.test(mask, 0.99);
            assertEquals(10, r.exceptions());
            assertEquals(12.955491, r.statistic(), 1e-5);
            assertEquals(3.19e-4, r.pValue(), 1e-5);
        }

        @Test
        @DisplayName("zero exceptions is finite thanks to clipping")
        void zeroExceptions() {
            KupiecTest.Result r = KupiecTest.test(new boolean[100], 0.99);
            assertEquals(2.0100672, r.statistic(), 1e-5);
            assertTrue(Double.isFinite(r.pValue()));
        }

        @Test
        @DisplayName("no observations is an input error")
        void empty() {
            assertThrows(InvalidInputException.class, () -> KupiecTest.test(new boolean[0], 0.99));
        }
    }

    @Nested
    @DisplayName("ChristoffersenTest")
    class ChristoffersenTests {

        @Test
        @DisplayName("no exceptions at all → independence undefined, counts still populated")
        void neverLeavesState() {
            ChristoffersenTest.Independence ind = ChristoffersenTest.independence(new boolean[50]);
            assertEquals(49, ind.n00());
            assertEquals(0, ind.n01() + ind.n10() + ind.n11());
            assertTrue(Double.isNaN(ind.statistic()));
            assertTrue(Double.isNaN(ind.pValue()));

            ChristoffersenTest.ConditionalCoverage cc = ChristoffersenTest.conditionalCoverage(
                KupiecTest.test(new boolean[50], 0.99), ind);
            assertTrue(Double.isNaN(cc.statistic()));
            assertTrue(Double.isNaN(cc.pValue()));
        }

        @Test
        @DisplayName("fewer than two observations → undefined")
        void tooShort() {
            assertTrue(Double.isNaN(ChristoffersenTest.independence(new boolean[] {true}).statistic()));
        }

        @Test
        @DisplayName("clustered exceptions are detected")
        void clustered() {
            boolean[] mask = exceptionsAt(100, 10, 11, 12, 13, 50);
            ChristoffersenTest.Independence ind = ChristoffersenTest.independence(mask);

            assertEquals(92, ind.n00());
            assertEquals(2, ind.n01());
            assertEquals(2, ind.n10());
            assertEquals(3, ind.n11());
            assertEquals(13.512083, ind.statistic(), 1e-5);
            assertTrue(ind.pValue() < 0.001);

            KupiecTest.Result pof = KupiecTest.test(mask, 0.95);
            ChristoffersenTest.ConditionalCoverage cc = ChristoffersenTest.conditionalCoverage(pof, ind);
            assertEquals(pof.statistic() + ind.statistic(), cc.statistic(), 1e-12);
            assertTrue(cc.pValue() > 0.0 && cc.pValue() < 0.01);
        }
    }

    @Nested
    @DisplayName("BaselTrafficLight")
    class BaselTests {

        @Test
        @DisplayName("250 observations: green ≤ 4, yellow ≤ 9, red beyond")
        void referenceWindow() {
            assertEquals(new BaselTrafficLight.Thresholds(4, 9), BaselTrafficLight.thresholds(250));
            assertEquals(TrafficLight.GREEN, BaselTrafficLight.classify(250, 4, 0.99));
            assertEquals(TrafficLight.YELLOW, BaselTrafficLight.classify(250, 5, 0.99));
            assertEquals(TrafficLight.YELLOW, BaselTrafficLight.classify(250, 9, 0.99));
            assertEquals(TrafficLight.RED, BaselTrafficLight.classify(250, 10, 0.99));
        }

        @Test
        @DisplayName("scaled thresholds round half to even")
        void halfToEven() {
            // 9 · 125 / 250 = 4.5 → 4, 9 · 375 / 250 = 13.5 → 14
            assertEquals(new BaselTrafficLight.Thresholds(2, 4), BaselTrafficLight.thresholds(125));
            assertEquals(new BaselTrafficLight.Thresholds(6, 14), BaselTrafficLight.thresholds(375));
        }

        @Test
        @DisplayName("fewer than 80 observations → UNDEFINED; other confidence levels → NOT_APPLICABLE")
        void notClassified() {
            assertEquals(TrafficLight.UNDEFINED, BaselTrafficLight.classify(79, 0, 0.99));
            assertFalse(BaselTrafficLight.thresholds(79).isDefined());
            assertEquals(TrafficLight.NOT_APPLICABLE, BaselTrafficLight.classify(250, 0, 0.95));
            assertFalse(BaselTrafficLight.thresholds(250, 0.95).isDefined());
        }
    }

    @Nested
    @DisplayName("VarBacktester")
    class BacktesterTests {

        @Test
        @DisplayName("undefined VaR dates are dropped; exceptions are strict")
        void dropsUndefined() {
            List<LocalDate> dates = SyntheticPanels.businessDays(5);
            VaRSeries var = new VaRSeries(dates, new double[] {Double.NaN, Double.NaN, -0.02, -0.02, -0.02}, 0.99);
            BacktestResult r = VarBacktester.backtest(var, new double[] {-0.5, -0.5, -0.03, -0.02, 0.01});

            assertEquals(3, r.observations());
            assertEquals(1, r.exceptionCount());
            assertArrayEquals(new boolean[] {true, false, false}, r.exceptions());
            assertEquals(dates.subList(2, 5), r.dates());
            assertEquals(0.03, r.expectedExceptions(), 1e-12);
            assertEquals(TrafficLight.UNDEFINED, r.zone());
        }

        @Test
        @DisplayName("a series with no defined VaR is an input error")
        void nothingToTest() {
            VaRSeries var = new VaRSeries(SyntheticPanels.businessDays(2), new double[] {Double.NaN, Double.NaN}, 0.99);
            assertThrows(InvalidInputException.class, () -> VarBacktester.backtest(var, new double[] {0.0, 0.0}));
        }

        @Test
        @DisplayName("exception rate converges to 1 − α on i.i.d. t(5) data with the true VaR")
        void rateConverges() {
            int n = 20_000;
            double[] realized = SyntheticPanels.independentT(n, 1, 5, 0.01, 777).column(0);
            double[] threshold = new double[n];
            Arrays.fill(threshold, 0.01 * StudentT.quantile(0.01, 5));
            BacktestResult r = VarBacktester.backtest(
                new VaRSeries(SyntheticPanels.businessDays(n), threshold, 0.99), realized);

            assertEquals(0.01, r.exceptionRate(), 0.003);
            assertEquals(200.0, r.expectedExceptions(), 1e-9);
        }

        @Test
        @DisplayName("historical backtest at 95% reports NOT_APPLICABLE and no thresholds")
        void historicalAt95() {
            double[] returns = SyntheticPanels.independentT(400, 1, 5, 0.01, 12).column(0);
            BacktestResult r = VarBacktester.backtestHistorical(SyntheticPanels.businessDays(400), returns, 0.95, 250);

            assertEquals(150, r.observations());
            assertEquals(TrafficLight.NOT_APPLICABLE, r.zone());
            assertNull(r.thresholds().greenMax());
        }
    }

    @Nested
    @DisplayName("BacktestSweep")
    class SweepTests {

        @Test
        @DisplayName("one row per window that leaves observations to test")
        void skipsOversizedWindows() {
            double[] returns = SyntheticPanels.independentT(100, 1, 5, 0.01, 2).column(0);
            List<BacktestSweep.Row> rows = BacktestSweep.run(
                SyntheticPanels.businessDays(100), returns, 0.99, List.of(20, 60, 100, 150));

            assertEquals(List.of(20, 60), rows.stream().map(BacktestSweep.Row::window).toList());
            assertEquals(80, rows.get(0).observations());
            assertNotEquals(TrafficLight.UNDEFINED, rows.get(0).zone());
            assertNotEquals(TrafficLight.NOT_APPLICABLE, rows.get(0).zone());
        }
    }
}
