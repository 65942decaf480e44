package com.memeinsight.common.trace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CycleTraceTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("trace id and scope reach inner fetches through the context")
    void boundToContext() {
        Mono<String> fetch = Mono.deferContextual(ctx ->
            Mono.just(CycleTrace.traceId(ctx) + "/" + CycleTrace.scope(ctx)));

        StepVerifier.create(CycleTrace.bind(Mono.just("x").flatMap(x -> fetch), "t-1", "GME"))
            .expectNext("t-1/GME")
            .verifyComplete();
    }

    @Test
    @DisplayName("outside a cycle the trace id is unknown")
    void unbound() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(CycleTrace.traceId(ctx))))
            .expectNext("unknown")
            .verifyComplete();
    }

    @Test
    @DisplayName("MDC carries trace id and source for one log action only")
    void mdcScopedToAction() {
        List<String> seen = new ArrayList<>();

        CycleTrace.log("t-2", "alpha-vantage", () -> {
            seen.add(MDC.get(CycleTrace.TRACE_ID));
            seen.add(MDC.get(CycleTrace.SOURCE));
        });

        assertEquals(List.of("t-2", "alpha-vantage"), seen);
        assertNull(MDC.get(CycleTrace.TRACE_ID));
        assertNull(MDC.get(CycleTrace.SOURCE));
    }

    @Test
    @DisplayName("MDC is cleaned up when the log action throws")
    void mdcClearedOnFailure() {
        assertThrows(IllegalStateException.class, () -> CycleTrace.log("t-3", () -> {
            throw new IllegalStateException("boom");
        }));
        assertNull(MDC.get(CycleTrace.TRACE_ID));
    }
}
