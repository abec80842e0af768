package com.riskplatform.engine.service;

import com.riskplatform.common.backtest.BacktestResult;
import com.riskplatform.common.backtest.BacktestSweep;
import com.riskplatform.common.backtest.VarBacktester;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.engine.logger.RiskFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Rolling historical-VaR backtests of the weighted portfolio return series.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final RiskFlowLogger flowLogger;

    public BacktestService(RiskFlowLogger flowLogger) {
        this.flowLogger = flowLogger;
    }

    public Mono<BacktestResult> backtest(ReturnPanel panel, WeightVector weights, double confidence, int window) {
        return Mono.fromCallable(() -> VarBacktester.backtestHistorical(
                panel.dates(), panel.portfolioReturns(weights), confidence, window))
            .doOnNext(r -> log.info("Backtest done. window={} observations={} exceptions={} zone={}",
                window, r.observations(), r.exceptionCount(), r.zone()))
            .doOnEach(flowLogger.stage(RiskFlowLogger.BACKTEST_COMPLETED));
    }

    public Mono<List<BacktestSweep.Row>> sweep(ReturnPanel panel, WeightVector weights,
                                              double confidence, List<Integer> windows) {
        return Mono.fromCallable(() -> BacktestSweep.run(
                panel.dates(), panel.portfolioReturns(weights), confidence, windows))
            .doOnEach(flowLogger.stage(RiskFlowLogger.BACKTEST_COMPLETED));
    }
}
