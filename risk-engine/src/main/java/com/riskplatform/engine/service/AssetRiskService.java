package com.riskplatform.engine.service;

import com.riskplatform.common.dependence.EwmaCovarianceEstimator;
import com.riskplatform.common.marginal.GarchTEstimator;
import com.riskplatform.common.marginal.MarginalEstimator;
import com.riskplatform.common.marginal.StaticStudentTEstimator;
import com.riskplatform.common.model.AssetRiskRow;
import com.riskplatform.common.model.MarginalModel;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.portfolio.AssetRiskRanking;
import com.riskplatform.engine.config.RiskSettings;
import com.riskplatform.engine.dto.AssetRiskReport;
import com.riskplatform.engine.logger.RiskFlowLogger;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Fits per-asset marginals as independent tasks on the bounded-elastic scheduler.
 *
 * <p>Asset j draws from its own generator seeded with {@code seed + j}, so results do
 * not depend on task interleaving. In risk tables a failed fit becomes a row carrying
 * the error while the other assets complete.
 */
@Service
public class AssetRiskService {

    private static final Logger log = LoggerFactory.getLogger(AssetRiskService.class);

    private final StaticStudentTEstimator staticEstimator;
    private final GarchTEstimator garchEstimator;
    private final RiskSettings settings;
    private final RiskFlowLogger flowLogger;

    public AssetRiskService(StaticStudentTEstimator staticEstimator, GarchTEstimator garchEstimator,
                            RiskSettings settings, RiskFlowLogger flowLogger) {
        this.staticEstimator = staticEstimator;
        this.garchEstimator = garchEstimator;
        this.settings = settings;
        this.flowLogger = flowLogger;
    }

    public Mono<AssetRiskReport> analyze(ReturnPanel panel, long seed) {
        log.info("Fitting static and GARCH marginals for {} assets over {} observations",
            panel.assetCount(), panel.observationCount());
        return Mono.zip(riskTable(panel, staticEstimator, seed), riskTable(panel, garchEstimator, seed))
            .map(tables -> {
                List<AssetRiskRow> staticRows = tables.getT1();
                List<AssetRiskRow> garchRows = tables.getT2();
                int top = AssetRiskRanking.DEFAULT_TOP;
                return new AssetRiskReport(staticRows, garchRows,
                    AssetRiskRanking.worst(staticRows, top), AssetRiskRanking.best(staticRows, top),
                    AssetRiskRanking.worst(garchRows, top), AssetRiskRanking.best(garchRows, top),
                    new EwmaCovarianceEstimator(settings.ewmaLambda()).volatilityVector(panel));
            })
            .doOnEach(flowLogger.stage(RiskFlowLogger.MARGINALS_FITTED));
    }

    /** One row per asset in panel order; failures are isolated into error rows. */
    public Mono<List<AssetRiskRow>> riskTable(ReturnPanel panel, MarginalEstimator estimator, long seed) {
        return Flux.range(0, panel.assetCount())
            .flatMapSequential(j -> {
                String asset = panel.assets().get(j);
                return fitOne(panel, j, estimator, seed)
                    .map(AssetRiskRow::of)
                    .onErrorResume(e -> {
                        log.error("Marginal fit failed. asset={} kind={}", asset, estimator.kind(), e);
                        return Mono.just(AssetRiskRow.failed(asset, estimator.kind(), e.getMessage()));
                    });
            })
            .collectList();
    }

    /** Every asset's marginal in panel order; any failure fails the whole list. */
    public Mono<List<MarginalModel>> fitMarginals(ReturnPanel panel, MarginalEstimator estimator, long seed) {
        return Flux.range(0, panel.assetCount())
            .flatMapSequential(j -> fitOne(panel, j, estimator, seed))
            .collectList();
    }

    private Mono<MarginalModel> fitOne(ReturnPanel panel, int j, MarginalEstimator estimator, long seed) {
        String asset = panel.assets().get(j);
        return Mono.fromCallable(() -> estimator.fit(asset, panel.column(j), new Well19937c(seed + j)))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(m -> log.debug("Marginal fitted. asset={} kind={} nu={} sigma={} converged={}",
                asset, m.kind(), m.nu(), m.sigma(), m.converged()));
    }

    public GarchTEstimator garchEstimator() {
        return garchEstimator;
    }
}
