package com.agenthub.engine.agent;

import com.agenthub.common.agent.Agent;
import com.agenthub.common.exception.AgentException;
import com.agenthub.common.exception.AgentProcessingException;
import com.agenthub.common.model.AgentResponse;
import com.agenthub.engine.reasoning.ReasoningClient;
import com.agenthub.engine.reasoning.ReasoningRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Shared behaviour of the LLM-backed agent types: send the type's system prompt plus the
 * user input to the {@link ReasoningClient}, forward every fragment to the caller, and fold
 * the stream into one {@link AgentResponse}.
 *
 * <p>All per-call state lives inside the deferred pipeline, so one instance serves any number
 * of sessions concurrently.
 */
public abstract class SpecializedLlmAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(SpecializedLlmAgent.class);

    private final ReasoningClient reasoningClient;
    private final AtomicBoolean released = new AtomicBoolean(false);

    protected SpecializedLlmAgent(ReasoningClient reasoningClient) {
        this.reasoningClient = reasoningClient;
    }

    /** Role instructions sent as the system prompt. */
    protected abstract String systemPrompt();

    protected double temperature() {
        return 0.3;
    }

    @Override
    public Mono<AgentResponse> process(String input, String sessionId, Consumer<String> onFragment) {
        return Mono.defer(() -> {
            if (released.get()) {
                return Mono.error(new AgentProcessingException(agentType(),
                    "Agent instance has been released", null));
            }

            long startTime = System.currentTimeMillis();
            StringBuilder content = new StringBuilder();
            int[] fragmentCount = {0};

            ReasoningRequest request = new ReasoningRequest(agentType(), systemPrompt(), input,
                sessionId, temperature());

            return reasoningClient.stream(request)
                .doOnNext(fragment -> {
                    content.append(fragment);
                    fragmentCount[0]++;
                    onFragment.accept(fragment);
                })
                .then(Mono.fromCallable(() -> {
                    long latencyMs = System.currentTimeMillis() - startTime;
                    log.info("[{}] Response complete. sessionId={} fragments={} latencyMs={}",
                             agentType(), sessionId, fragmentCount[0], latencyMs);
                    return AgentResponse.of(sessionId, agentType(), content.toString(), Map.of(
                        "agent", agentType(),
                        "fragments", fragmentCount[0],
                        "latencyMs", latencyMs));
                }))
                .onErrorMap(e -> !(e instanceof AgentException),
                    e -> new AgentProcessingException(agentType(), "Reasoning call failed: " + e.getMessage(), e));
        });
    }

    @Override
    public void release() {
        if (released.compareAndSet(false, true)) {
            log.info("[{}] Released agent instance", agentType());
        }
    }

    public boolean isReleased() {
        return released.get();
    }
}
