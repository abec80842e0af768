package com.riskplatform.engine.service;

import com.riskplatform.common.dependence.EwmaCovarianceEstimator;
import com.riskplatform.common.dependence.SampleCorrelation;
import com.riskplatform.common.model.PortfolioRisk;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.RiskModel;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.common.montecarlo.SimulationSettings;
import com.riskplatform.common.portfolio.GarchTPortfolioAggregator;
import com.riskplatform.common.portfolio.HistoricalAggregator;
import com.riskplatform.common.portfolio.StaticTPortfolioAggregator;
import com.riskplatform.engine.config.CorrelationSource;
import com.riskplatform.engine.config.RiskSettings;
import com.riskplatform.engine.dto.PortfolioRiskSummary;
import com.riskplatform.engine.dto.PortfolioSummaryRow;
import com.riskplatform.engine.logger.RiskFlowLogger;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Portfolio summary: static-t, GARCH-t and historical at one day, then the t-copula
 * simulation at every configured horizon. All figures are also scaled by the notional.
 */
@Service
public class PortfolioRiskService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioRiskService.class);

    private final StaticTPortfolioAggregator staticAggregator;
    private final GarchTPortfolioAggregator garchAggregator;
    private final HistoricalAggregator historicalAggregator;
    private final AssetRiskService assetRiskService;
    private final MonteCarloService monteCarloService;
    private final RiskSettings settings;
    private final RiskFlowLogger flowLogger;

    public PortfolioRiskService(StaticTPortfolioAggregator staticAggregator,
                                GarchTPortfolioAggregator garchAggregator,
                                HistoricalAggregator historicalAggregator,
                                AssetRiskService assetRiskService,
                                MonteCarloService monteCarloService,
                                RiskSettings settings,
                                RiskFlowLogger flowLogger) {
        this.staticAggregator = staticAggregator;
        this.garchAggregator = garchAggregator;
        this.historicalAggregator = historicalAggregator;
        this.assetRiskService = assetRiskService;
        this.monteCarloService = monteCarloService;
        this.settings = settings;
        this.flowLogger = flowLogger;
    }

    public Mono<PortfolioRiskSummary> summarize(ReturnPanel panel, WeightVector weights, long seed, int scenarios) {
        Mono<PortfolioRisk> staticT = Mono.fromCallable(() ->
                staticAggregator.aggregate(panel, weights, new Well19937c(seed)))
            .subscribeOn(Schedulers.boundedElastic());

        Mono<PortfolioRisk> garchT = assetRiskService.fitMarginals(panel, assetRiskService.garchEstimator(), seed)
            .map(marginals -> garchAggregator.aggregate(weights, marginals, correlation(panel)));

        Mono<PortfolioRisk> historical = Mono.fromCallable(() -> historicalAggregator.aggregate(panel, weights));

        Mono<List<PortfolioSummaryRow>> parametric = Mono.zip(staticT, garchT, historical)
            .map(models -> List.of(oneDay(models.getT1()), oneDay(models.getT2()), oneDay(models.getT3())))
            .doOnEach(flowLogger.stage(RiskFlowLogger.PORTFOLIO_AGGREGATED));

        Mono<List<PortfolioSummaryRow>> simulated = Flux.fromIterable(settings.horizons())
            .concatMap(h -> {
                SimulationSettings run = monteCarloService.defaults(h, scenarios);
                return monteCarloService.run(panel, weights, run, seed)
                    .map(result -> new PortfolioSummaryRow(RiskModel.MONTE_CARLO, h, run.nuMarginal(),
                        result.returnRiskMeasures(), result.pnlRiskMeasures()));
            })
            .collectList();

        return parametric.zipWith(simulated, (p, s) -> {
                List<PortfolioSummaryRow> rows = new ArrayList<>(p);
                rows.addAll(s);
                log.info("Portfolio summary ready. models={} horizons={}", rows.size(), settings.horizons());
                return new PortfolioRiskSummary(settings.notional(), settings.garchCorrelation(), rows);
            })
            .doOnEach(flowLogger.stage(RiskFlowLogger.SUMMARY_ASSEMBLED));
    }

    private PortfolioSummaryRow oneDay(PortfolioRisk risk) {
        return new PortfolioSummaryRow(risk.model(), 1, risk.nu(), risk.measures(),
            risk.measures().scaled(settings.notional()));
    }

    private double[][] correlation(ReturnPanel panel) {
        return settings.garchCorrelation() == CorrelationSource.SAMPLE
            ? SampleCorrelation.of(panel)
            : new EwmaCovarianceEstimator(settings.ewmaLambda()).estimate(panel).correlation();
    }
}
