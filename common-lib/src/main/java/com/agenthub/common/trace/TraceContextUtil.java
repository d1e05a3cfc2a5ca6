package com.agenthub.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the turn id and session id of one submitted message through a reactive pipeline.
 *
 * <p>Reactor Context is the source of truth inside the pipeline. MDC is written only as a
 * short bridge around a single log statement, because a turn hops between scheduler threads
 * and a ThreadLocal would leak into whichever session runs next on that thread.
 *
 * <pre>
 *     return TraceContextUtil.withTurn(pipeline, turnId, sessionId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY   = "traceId";
    public static final String SESSION_ID_KEY = "sessionId";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores both ids in the Reactor Context. {@code contextWrite} propagates upstream at
     * subscription, so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withTurn(Mono<T> mono, String turnId, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, turnId).put(SESSION_ID_KEY, sessionId));
    }

    /** Returns {@code "unknown"} if absent, never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Returns {@code "unknown"} if absent, never {@code null}. */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with both ids in MDC, then removes them.
     * Only for logging side-effects.
     */
    public static void withMdc(String traceId, String sessionId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
