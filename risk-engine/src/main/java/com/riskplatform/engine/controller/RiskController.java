package com.riskplatform.engine.controller;

import com.riskplatform.common.backtest.BacktestResult;
import com.riskplatform.common.backtest.BacktestSweep;
import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.model.ReturnPanel;
import com.riskplatform.common.model.WeightVector;
import com.riskplatform.engine.config.RiskSettings;
import com.riskplatform.engine.dto.AssetRiskReport;
import com.riskplatform.engine.dto.AssetRiskRequest;
import com.riskplatform.engine.dto.BacktestRequest;
import com.riskplatform.engine.dto.MonteCarloReport;
import com.riskplatform.engine.dto.MonteCarloRequest;
import com.riskplatform.engine.dto.PanelPayload;
import com.riskplatform.engine.dto.PortfolioRiskRequest;
import com.riskplatform.engine.dto.PortfolioRiskSummary;
import com.riskplatform.engine.logger.RiskFlowLogger;
import com.riskplatform.engine.service.AssetRiskService;
import com.riskplatform.engine.service.BacktestService;
import com.riskplatform.engine.service.MonteCarloService;
import com.riskplatform.engine.service.PortfolioRiskService;
import com.riskplatform.engine.trace.RiskRunContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/risk")
public class RiskController {

    private final AssetRiskService assetRiskService;
    private final PortfolioRiskService portfolioRiskService;
    private final MonteCarloService monteCarloService;
    private final BacktestService backtestService;
    private final RiskSettings settings;
    private final RiskFlowLogger flowLogger;

    public RiskController(AssetRiskService assetRiskService,
                          PortfolioRiskService portfolioRiskService,
                          MonteCarloService monteCarloService,
                          BacktestService backtestService,
                          RiskSettings settings,
                          RiskFlowLogger flowLogger) {
        this.assetRiskService = assetRiskService;
        this.portfolioRiskService = portfolioRiskService;
        this.monteCarloService = monteCarloService;
        this.backtestService = backtestService;
        this.settings = settings;
        this.flowLogger = flowLogger;
    }

    @PostMapping("/assets")
    public Mono<ResponseEntity<AssetRiskReport>> assets(
            @RequestBody AssetRiskRequest request,
            @RequestHeader(value = "X-Run-Id", required = false) String runIdHeader) {
        String runId = runId(runIdHeader);
        return traced(runId, "assets", Mono.defer(() -> assetRiskService.analyze(
            panel(request.panel()), seed(request.seed()))));
    }

    @PostMapping("/portfolio")
    public Mono<ResponseEntity<PortfolioRiskSummary>> portfolio(
            @RequestBody PortfolioRiskRequest request,
            @RequestHeader(value = "X-Run-Id", required = false) String runIdHeader) {
        String runId = runId(runIdHeader);
        return traced(runId, "portfolio", Mono.defer(() -> {
            ReturnPanel panel = panel(request.panel());
            int scenarios = request.scenarios() != null ? request.scenarios() : settings.scenarios();
            return portfolioRiskService.summarize(panel, weights(panel, request.weights()),
                seed(request.seed()), scenarios);
        }));
    }

    @PostMapping("/montecarlo")
    public Mono<ResponseEntity<MonteCarloReport>> monteCarlo(
            @RequestBody MonteCarloRequest request,
            @RequestHeader(value = "X-Run-Id", required = false) String runIdHeader) {
        String runId = runId(runIdHeader);
        return traced(runId, "montecarlo", Mono.defer(() -> {
            ReturnPanel panel = panel(request.panel());
            return monteCarloService.report(panel, weights(panel, request.weights()),
                monteCarloService.resolve(request), seed(request.seed()),
                Boolean.TRUE.equals(request.includePnl()));
        }));
    }

    @PostMapping("/backtest")
    public Mono<ResponseEntity<BacktestResult>> backtest(
            @RequestBody BacktestRequest request,
            @RequestHeader(value = "X-Run-Id", required = false) String runIdHeader) {
        String runId = runId(runIdHeader);
        return traced(runId, "backtest", Mono.defer(() -> {
            ReturnPanel panel = panel(request.panel());
            return backtestService.backtest(panel, weights(panel, request.weights()),
                confidence(request), request.window() != null ? request.window() : settings.backtestWindow());
        }));
    }

    @PostMapping("/backtest/sweep")
    public Mono<ResponseEntity<List<BacktestSweep.Row>>> sweep(
            @RequestBody BacktestRequest request,
            @RequestHeader(value = "X-Run-Id", required = false) String runIdHeader) {
        String runId = runId(runIdHeader);
        return traced(runId, "backtest-sweep", Mono.defer(() -> {
            ReturnPanel panel = panel(request.panel());
            List<Integer> windows = request.windows() != null ? request.windows() : settings.sweepWindows();
            return backtestService.sweep(panel, weights(panel, request.weights()), confidence(request), windows);
        }));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private <T> Mono<ResponseEntity<T>> traced(String runId, String operation, Mono<T> pipeline) {
        RiskRunContext run = new RiskRunContext(runId, operation);
        flowLogger.log(RiskFlowLogger.REQUEST_RECEIVED, run);
        return run.attach(pipeline.map(ResponseEntity::ok));
    }

    private static ReturnPanel panel(PanelPayload payload) {
        if (payload == null) {
            throw new InvalidInputException("RiskController", "request has no panel");
        }
        return payload.toReturnPanel();
    }

    /** Missing weights mean an equally weighted portfolio. */
    private static WeightVector weights(ReturnPanel panel, Map<String, Double> raw) {
        return raw == null ? WeightVector.equal(panel) : WeightVector.align(panel, raw);
    }

    private long seed(Long requested) {
        return requested != null ? requested : settings.seed();
    }

    private double confidence(BacktestRequest request) {
        return request.confidence() != null ? request.confidence() : settings.backtestConfidence();
    }

    private static String runId(String header) {
        return header != null && !header.isBlank() ? header : UUID.randomUUID().toString();
    }
}
