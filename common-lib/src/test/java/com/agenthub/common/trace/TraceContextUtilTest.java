package com.agenthub.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    @DisplayName("turn and session ids are readable from the Reactor Context")
    void idsPropagateThroughContext() {
        Mono<String> pipeline = Mono.deferContextual(ctx ->
            Mono.just(TraceContextUtil.getTraceId(ctx) + "/" + TraceContextUtil.getSessionId(ctx)));

        StepVerifier.create(TraceContextUtil.withTurn(pipeline, "turn-1", "s-1"))
            .expectNext("turn-1/s-1")
            .verifyComplete();
    }

    @Test
    @DisplayName("missing ids read as 'unknown'")
    void missingIds() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx))))
            .expectNext("unknown")
            .verifyComplete();
    }

    @Test
    @DisplayName("MDC is populated only for the duration of the log action")
    void mdcBridgeIsScoped() {
        AtomicReference<String> seen = new AtomicReference<>();

        TraceContextUtil.withMdc("turn-2", "s-2", () -> seen.set(MDC.get(TraceContextUtil.TRACE_ID_KEY)));

        assertEquals("turn-2", seen.get());
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
        assertNull(MDC.get(TraceContextUtil.SESSION_ID_KEY));
    }
}
