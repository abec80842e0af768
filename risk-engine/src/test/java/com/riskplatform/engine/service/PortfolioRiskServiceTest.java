package com.riskplatform.engine.service;

import com.riskplatform.common.marginal.DegreesOfFreedomSearch;
import com.riskplatform.common.marginal.GarchTEstimator;
import com.riskplatform.common.marginal.StaticStudentTEstimator;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.RiskModel;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.common.montecarlo.TCopulaSimulator;
import com.riskplatform.common.portfolio.GarchTPortfolioAggregator;
import com.riskplatform.common.portfolio.HistoricalAggregator;
import com.riskplatform.common.portfolio.StaticTPortfolioAggregator;
import com.riskplatform.engine.TestFixtures;
import com.riskplatform.engine.config.CorrelationSource;
import com.riskplatform.engine.config.RiskSettings;
import com.riskplatform.engine.dto.PortfolioSummaryRow;
import com.riskplatform.engine.logger.RiskFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioRiskServiceTest {

    private static PortfolioRiskService service(RiskSettings settings) {
        RiskFlowLogger flowLogger = new RiskFlowLogger();
        DegreesOfFreedomSearch search = new DegreesOfFreedomSearch(settings.minDf(), settings.maxDf());
        AssetRiskService assets = new AssetRiskService(new StaticStudentTEstimator(search),
            new GarchTEstimator(), settings, flowLogger);
        MonteCarloService monteCarlo = new MonteCarloService(new TCopulaSimulator(), settings, flowLogger);
        return new PortfolioRiskService(new StaticTPortfolioAggregator(search), new GarchTPortfolioAggregator(),
            new HistoricalAggregator(), assets, monteCarlo, settings, flowLogger);
    }

    @Test
    @DisplayName("summary holds static-t, GARCH-t, historical and one Monte Carlo row per horizon")
    void fullSummary() {
        ReturnPanel panel = TestFixtures.panel(300, 3, 11);
        WeightVector weights = WeightVector.align(panel, Map.of("A1", 0.5, "A2", 0.3, "A3", 0.2));

        StepVerifier.create(service(TestFixtures.settings()).summarize(panel, weights, 42L, 2_000))
            .assertNext(summary -> {
                List<PortfolioSummaryRow> rows = summary.rows();
                assertEquals(List.of(RiskModel.STATIC_T, RiskModel.GARCH_T, RiskModel.HISTORICAL,
                    RiskModel.MONTE_CARLO, RiskModel.MONTE_CARLO), rows.stream().map(PortfolioSummaryRow::model).toList());
                assertEquals(List.of(1, 1, 1, 1, 10), rows.stream().map(PortfolioSummaryRow::horizonDays).toList());
                assertEquals(CorrelationSource.EWMA, summary.garchCorrelation());

                for (PortfolioSummaryRow row : rows.subList(0, 3)) {
                    assertEquals(row.measures().var95() * 1_000_000, row.amounts().var95(), 1e-6);
                    assertTrue(row.measures().es99() <= row.measures().var99(), row.model().name());
                }
                assertTrue(rows.get(4).measures().var95() < rows.get(3).measures().var95());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("sample correlation is used for the GARCH-t row when configured")
    void sampleCorrelation() {
        ReturnPanel panel = TestFixtures.panel(200, 2, 4);
        StepVerifier.create(service(TestFixtures.settings(CorrelationSource.SAMPLE))
                .summarize(panel, WeightVector.equal(panel), 1L, 500))
            .assertNext(summary -> {
                assertEquals(CorrelationSource.SAMPLE, summary.garchCorrelation());
                assertTrue(summary.rows().get(1).measures().var95() < 0.0);
            })
            .verifyComplete();
    }
}
