package com.agenthub.orchestrator.support;

import com.agenthub.common.agent.Agent;
import com.agenthub.common.model.AgentResponse;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Test agent whose calls stay open until the test drives them: {@link #emit} pushes a fragment
 * to the session's call, {@link #finish} completes it, {@link #fail} errors it.
 *
 * <p>With {@code autoReply} set every call answers immediately with that text instead.
 */
public class ScriptedAgent implements Agent {

    private final String agentType;
    private final String autoReply;
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final AtomicInteger releaseCount = new AtomicInteger();
    private final AtomicInteger callCount = new AtomicInteger();

    public ScriptedAgent(String agentType) {
        this(agentType, null);
    }

    public ScriptedAgent(String agentType, String autoReply) {
        this.agentType = agentType;
        this.autoReply = autoReply;
    }

    @Override
    public String agentType() {
        return agentType;
    }

    @Override
    public Mono<AgentResponse> process(String input, String sessionId, Consumer<String> onFragment) {
        callCount.incrementAndGet();
        if (autoReply != null) {
            return Mono.fromCallable(() -> {
                onFragment.accept(autoReply);
                return AgentResponse.of(sessionId, agentType, autoReply, Map.of("agent", agentType));
            });
        }
        Sinks.One<AgentResponse> result = Sinks.one();
        pending.put(sessionId, new PendingCall(onFragment, result));
        return result.asMono();
    }

    public boolean hasPendingCall(String sessionId) {
        return pending.containsKey(sessionId);
    }

    public void emit(String sessionId, String fragment) {
        pending.get(sessionId).onFragment().accept(fragment);
    }

    public void finish(String sessionId, String content) {
        pending.remove(sessionId).result()
            .tryEmitValue(AgentResponse.of(sessionId, agentType, content, Map.of("agent", agentType)));
    }

    public void fail(String sessionId, RuntimeException error) {
        pending.remove(sessionId).result().tryEmitError(error);
    }

    @Override
    public void release() {
        releaseCount.incrementAndGet();
    }

    public int releaseCount() {
        return releaseCount.get();
    }

    public int callCount() {
        return callCount.get();
    }

    private record PendingCall(Consumer<String> onFragment, Sinks.One<AgentResponse> result) {}
}
