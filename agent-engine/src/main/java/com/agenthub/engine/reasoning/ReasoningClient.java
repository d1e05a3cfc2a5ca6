package com.agenthub.engine.reasoning;

import reactor.core.publisher.Flux;

/**
 * Streams the text of one model answer as it is generated.
 */
public interface ReasoningClient {

    /**
     * @return text fragments in generation order; completes when the answer is done
     */
    Flux<String> stream(ReasoningRequest request);
}
