package com.agenthub.orchestrator.logger;

import com.agenthub.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a turn inside the reactive pipeline. Pure side-effects: nothing here
 * changes what the pipeline emits.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #TURN_ACCEPTED}    — submit passed the busy check</li>
 *   <li>{@link #AGENT_DISPATCHED} — an agent instance was resolved</li>
 *   <li>{@link #TURN_COMPLETED}   — the agent answered</li>
 *   <li>{@link #TURN_FAILED}      — dispatch, processing or the timeout failed the turn</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (ids read from the Reactor Context):
 * <pre>
 *     .doOnEach(turnFlowLogger.stage(TurnFlowLogger.AGENT_DISPATCHED))
 * </pre>
 */
public class TurnFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(TurnFlowLogger.class);

    public static final String TURN_ACCEPTED    = "TURN_ACCEPTED";
    public static final String AGENT_DISPATCHED = "AGENT_DISPATCHED";
    public static final String TURN_COMPLETED   = "TURN_COMPLETED";
    public static final String TURN_FAILED      = "TURN_FAILED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext}.
     * Errors and completion are ignored; the Context is bridged into MDC for the log call only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId   = TraceContextUtil.getTraceId(signal.getContextView());
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            logWithIds(stageName, traceId, sessionId);
        };
    }

    /** For call sites outside a pipeline, where both ids are at hand. */
    public void logWithIds(String stageName, String traceId, String sessionId) {
        TraceContextUtil.withMdc(traceId, sessionId, () ->
            log.info("[TurnFlow] stage={} sessionId={} turnId={}", stageName, sessionId, traceId)
        );
    }

    public void logOutcome(String stageName, String traceId, String sessionId,
                           String agentType, long elapsedMs, String detail) {
        TraceContextUtil.withMdc(traceId, sessionId, () ->
            log.info("[TurnFlow] stage={} sessionId={} turnId={} agentType={} elapsedMs={} detail={}",
                     stageName, sessionId, traceId, agentType, elapsedMs, detail)
        );
    }
}
