package com.riskplatform.engine.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Identity of one risk run: the caller's run id and the endpoint operation that started it.
 *
 * <p>Stored once in the Reactor Context at the end of pipeline assembly and read back by
 * {@code doOnEach} stage logging. MDC holds both keys only while a log call runs.
 *
 * @param runId     {@code X-Run-Id} header value or a generated UUID
 * @param operation endpoint name, e.g. {@code montecarlo}
 */
public record RiskRunContext(String runId, String operation) {

    public static final String RUN_ID_KEY = "runId";
    public static final String OPERATION_KEY = "operation";

    private static final String CONTEXT_KEY = RiskRunContext.class.getName();

    public static final RiskRunContext UNKNOWN = new RiskRunContext("unknown", "unknown");

    public <T> Mono<T> attach(Mono<T> pipeline) {
        return pipeline.contextWrite(ctx -> ctx.put(CONTEXT_KEY, this));
    }

    public static RiskRunContext from(ContextView ctx) {
        return ctx.getOrDefault(CONTEXT_KEY, UNKNOWN);
    }

    public void withMdc(Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        MDC.put(OPERATION_KEY, operation);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
            MDC.remove(OPERATION_KEY);
        }
    }
}
