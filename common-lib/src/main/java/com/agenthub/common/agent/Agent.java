package com.agenthub.common.agent;

import com.agenthub.common.model.AgentResponse;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * A unit that turns one input into a response, optionally streaming fragments as it goes.
 *
 * <p>One instance is shared by every session dispatched to its type, so implementations
 * must not keep per-call state on the instance.
 */
public interface Agent {

    String agentType();

    /**
     * @param onFragment receives streamed output in order; never {@code null}
     */
    Mono<AgentResponse> process(String input, String sessionId, Consumer<String> onFragment);

    default Mono<AgentResponse> process(String input, String sessionId) {
        return process(input, sessionId, fragment -> { });
    }

    /**
     * Frees external resources. Called once when the instance leaves the cache;
     * implementations must tolerate repeated calls.
     */
    default void release() { }
}
