package com.agenthub.engine.reasoning;

import java.time.Duration;

/**
 * Connection settings for {@link AnthropicReasoningClient}.
 *
 * @param apiKey    blank → every request is answered by the offline fallback
 * @param baseUrl   Messages API host
 * @param model     model identifier sent with every request
 * @param maxTokens upper bound on generated tokens per answer
 * @param idleTimeout longest silence tolerated between two streamed events
 */
public record ReasoningSettings(
    String apiKey,
    String baseUrl,
    String model,
    int maxTokens,
    Duration idleTimeout
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
