package com.riskplatform.engine.logger;

import com.riskplatform.engine.trace.RiskRunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages of a risk run without touching the computation.
 *
 * <p>Stages, in the order a full portfolio summary passes them:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}</li>
 *   <li>{@link #MARGINALS_FITTED}: per-asset static and GARCH fits done</li>
 *   <li>{@link #PORTFOLIO_AGGREGATED}: static-t, GARCH-t and historical figures ready</li>
 *   <li>{@link #SIMULATION_COMPLETED}: one Monte Carlo horizon finished</li>
 *   <li>{@link #BACKTEST_COMPLETED}</li>
 *   <li>{@link #SUMMARY_ASSEMBLED}</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(riskFlowLogger.stage(RiskFlowLogger.MARGINALS_FITTED))
 * </pre>
 */
@Component
public class RiskFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RiskFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String MARGINALS_FITTED     = "MARGINALS_FITTED";
    public static final String PORTFOLIO_AGGREGATED = "PORTFOLIO_AGGREGATED";
    public static final String SIMULATION_COMPLETED = "SIMULATION_COMPLETED";
    public static final String BACKTEST_COMPLETED   = "BACKTEST_COMPLETED";
    public static final String SUMMARY_ASSEMBLED    = "SUMMARY_ASSEMBLED";

    /**
     * A {@code doOnEach} consumer that logs {@code stageName} on every onNext signal,
     * reading the run from the signal's context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            RiskRunContext run = RiskRunContext.from(signal.getContextView());
            run.withMdc(() ->
                log.info("[RiskFlow] stage={} runId={} operation={}", stageName, run.runId(), run.operation())
            );
        };
    }

    /** Logs a stage outside a pipeline, before the run is attached to any context. */
    public void log(String stageName, RiskRunContext run) {
        run.withMdc(() ->
            log.info("[RiskFlow] stage={} runId={} operation={}", stageName, run.runId(), run.operation())
        );
    }
}
