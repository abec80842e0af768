package com.riskplatform.engine.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskRunContextTest {

    @Test
    @DisplayName("attached run is visible to operators upstream of the attach point")
    void attachAndRead() {
        RiskRunContext run = new RiskRunContext("run-7", "montecarlo");
        Mono<RiskRunContext> read = Mono.deferContextual(ctx -> Mono.just(RiskRunContext.from(ctx)));

        StepVerifier.create(run.attach(read))
            .expectNext(run)
            .verifyComplete();
    }

    @Test
    @DisplayName("a pipeline without an attached run reads UNKNOWN")
    void missingRun() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(RiskRunContext.from(ctx))))
            .expectNext(RiskRunContext.UNKNOWN)
            .verifyComplete();
    }

    @Test
    @DisplayName("MDC carries run id and operation only while the log action runs")
    void mdcScope() {
        List<String> seen = new ArrayList<>();
        new RiskRunContext("run-9", "backtest").withMdc(() -> {
            seen.add(MDC.get(RiskRunContext.RUN_ID_KEY));
            seen.add(MDC.get(RiskRunContext.OPERATION_KEY));
        });

        assertEquals(List.of("run-9", "backtest"), seen);
        assertNull(MDC.get(RiskRunContext.RUN_ID_KEY));
        assertNull(MDC.get(RiskRunContext.OPERATION_KEY));
    }
}
