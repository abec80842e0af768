package com.riskplatform.engine.service;

import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.common.montecarlo.ComponentExpectedShortfall;
import com.riskplatform.common.montecarlo.SimulationResult;
import com.riskplatform.common.montecarlo.SimulationSettings;
import com.riskplatform.common.montecarlo.TCopulaSimulator;
import com.riskplatform.engine.config.RiskSettings;
import com.riskplatform.engine.dto.MonteCarloReport;
import com.riskplatform.engine.dto.MonteCarloRequest;
import com.riskplatform.engine.logger.RiskFlowLogger;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Service
public class MonteCarloService {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloService.class);
    private static final double COMPONENT_CONFIDENCE = 0.95;

    private final TCopulaSimulator simulator;
    private final RiskSettings settings;
    private final RiskFlowLogger flowLogger;

    public MonteCarloService(TCopulaSimulator simulator, RiskSettings settings, RiskFlowLogger flowLogger) {
        this.simulator = simulator;
        this.settings = settings;
        this.flowLogger = flowLogger;
    }

    public Mono<SimulationResult> run(ReturnPanel panel, WeightVector weights, SimulationSettings run, long seed) {
        return Mono.fromCallable(() -> {
                log.info("Simulating {} scenarios over {}d for {} assets. nuCopula={} nuMarginal={} seed={}",
                    run.scenarios(), run.horizonDays(), panel.assetCount(), run.nuCopula(), run.nuMarginal(), seed);
                return simulator.simulate(panel, weights, run, new Well19937c(seed));
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(RiskFlowLogger.SIMULATION_COMPLETED));
    }

    public Mono<MonteCarloReport> report(ReturnPanel panel, WeightVector weights, SimulationSettings run,
                                         long seed, boolean includePnl) {
        return run(panel, weights, run, seed)
            .map(result -> new MonteCarloReport(run, seed,
                result.returnRiskMeasures(),
                result.pnlRiskMeasures(),
                ComponentExpectedShortfall.decompose(result, COMPONENT_CONFIDENCE),
                includePnl ? result.pnl() : null));
    }

    /** Configured defaults at {@code horizonDays}. */
    public SimulationSettings defaults(int horizonDays, int scenarios) {
        return new SimulationSettings(settings.notional(), scenarios, horizonDays,
            settings.ewmaLambda(), settings.nuCopula(), settings.nuMarginal());
    }

    /** Request values over configured defaults; a one-day horizon unless asked otherwise. */
    public SimulationSettings resolve(MonteCarloRequest request) {
        return new SimulationSettings(
            request.notional() != null ? request.notional() : settings.notional(),
            request.scenarios() != null ? request.scenarios() : settings.scenarios(),
            request.horizonDays() != null ? request.horizonDays() : 1,
            request.lambda() != null ? request.lambda() : settings.ewmaLambda(),
            request.nuCopula() != null ? request.nuCopula() : settings.nuCopula(),
            request.nuMarginal() != null ? request.nuMarginal() : settings.nuMarginal());
    }
}
