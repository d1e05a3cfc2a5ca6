package com.agenthub.orchestrator.service;

import com.agenthub.common.exception.AgentConstructionException;
import com.agenthub.common.exception.AgentProcessingException;
import com.agenthub.common.exception.SessionBusyException;
import com.agenthub.common.model.AgentResponse;
import com.agenthub.common.model.ErrorKind;
import com.agenthub.common.trace.TraceContextUtil;
import com.agenthub.orchestrator.dispatch.AgentDispatcher;
import com.agenthub.orchestrator.logger.TurnFlowLogger;
import com.agenthub.orchestrator.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for user messages: one in-flight turn per session, any number of sessions in
 * parallel.
 *
 * <p>Turn pipeline:
 * <pre>
 *   beginTurn (busy → reject) → dispatch → agent.process (fragments → session buffer)
 *     → timeout → completeTurn → receipt.response
 * </pre>
 *
 * <p><strong>Failure isolation:</strong> every error inside the pipeline becomes a failed
 * {@link AgentResponse} for the requesting session only. The session always returns to idle,
 * and nothing is retried at this level.
 */
public class RequestCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RequestCoordinator.class);

    private final SessionRegistry sessionRegistry;
    private final AgentDispatcher dispatcher;
    private final Duration turnTimeout;
    private final TurnFlowLogger turnFlowLogger;
    private final Clock clock;

    public RequestCoordinator(SessionRegistry sessionRegistry, AgentDispatcher dispatcher,
                              Duration turnTimeout, TurnFlowLogger turnFlowLogger, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.dispatcher      = dispatcher;
        this.turnTimeout     = turnTimeout;
        this.turnFlowLogger  = turnFlowLogger;
        this.clock           = clock;
    }

    /**
     * Accepts {@code input} for {@code sessionId} and starts the turn in the background.
     *
     * @throws SessionBusyException     when the session already has a turn in flight;
     *                                  that turn is left untouched
     * @throws IllegalArgumentException on a blank session id or input
     */
    public SubmissionReceipt submit(String sessionId, String input) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input must not be blank");
        }

        String turnId = UUID.randomUUID().toString();
        if (!sessionRegistry.beginTurn(sessionId, turnId)) {
            log.warn("[Coordinator] Rejected message, session busy. sessionId={}", sessionId);
            throw new SessionBusyException(sessionId);
        }

        Instant acceptedAt = clock.instant();
        turnFlowLogger.logWithIds(TurnFlowLogger.TURN_ACCEPTED, turnId, sessionId);

        Sinks.One<AgentResponse> outcome = Sinks.one();
        runTurn(sessionId, turnId, input).subscribe(
            outcome::tryEmitValue,
            e -> {
                // only reachable if completing the turn itself failed
                log.error("[Coordinator] Turn pipeline failed. sessionId={} turnId={}", sessionId, turnId, e);
                AgentResponse failure = AgentResponse.failure(sessionId, null, ErrorKind.PROCESSING, e.getMessage());
                sessionRegistry.completeTurn(sessionId, turnId, failure, null);
                outcome.tryEmitValue(failure);
            });

        return new SubmissionReceipt(sessionId, turnId, acceptedAt, outcome.asMono());
    }

    // ── turn pipeline ─────────────────────────────────────────────────────────

    private Mono<AgentResponse> runTurn(String sessionId, String turnId, String input) {
        final long startTime = System.currentTimeMillis();
        // Set once dispatch resolves; read when the turn completes or fails.
        final String[] resolvedType = {null};

        Mono<AgentResponse> pipeline = dispatcher.dispatch(input, sessionId)
            .doOnEach(turnFlowLogger.stage(TurnFlowLogger.AGENT_DISPATCHED))
            .flatMap(dispatch -> {
                String agentType = dispatch.agentType();
                resolvedType[0] = agentType;
                return dispatch.agent()
                    .process(input, sessionId,
                        fragment -> sessionRegistry.appendFragment(sessionId, turnId, fragment))
                    .switchIfEmpty(Mono.error(() -> new AgentProcessingException(agentType,
                        "Agent completed without a response", null)))
                    .timeout(turnTimeout)
                    .onErrorMap(TimeoutException.class,
                        e -> AgentProcessingException.timeout(agentType, turnTimeout, e));
            })
            .onErrorResume(e -> {
                log.error("[Coordinator] Turn failed. sessionId={} turnId={} agentType={} error={}",
                          sessionId, turnId, resolvedType[0], e.getMessage());
                return Mono.just(AgentResponse.failure(sessionId, resolvedType[0], errorKind(e), e.getMessage()));
            })
            .doOnNext(response -> {
                long elapsedMs = System.currentTimeMillis() - startTime;
                sessionRegistry.completeTurn(sessionId, turnId, response, resolvedType[0]);
                dispatcher.recordResponseTime(Duration.ofMillis(elapsedMs));
                turnFlowLogger.logOutcome(
                    response.success() ? TurnFlowLogger.TURN_COMPLETED : TurnFlowLogger.TURN_FAILED,
                    turnId, sessionId, resolvedType[0], elapsedMs,
                    response.success() ? "ok" : String.valueOf(response.errorKind()));
            });

        return TraceContextUtil.withTurn(pipeline, turnId, sessionId);
    }

    static ErrorKind errorKind(Throwable e) {
        if (e instanceof AgentConstructionException) {
            return ErrorKind.CONSTRUCTION;
        }
        if (e instanceof AgentProcessingException processing && processing.isTimedOut()) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.PROCESSING;
    }
}
