package com.agenthub.engine.reasoning;

/**
 * One prompt to the reasoning provider.
 *
 * @param agentType    the agent type asking, used for logging and the offline reply
 * @param systemPrompt role instructions of the agent type
 * @param input        the user's message
 * @param sessionId    conversation the request belongs to
 * @param temperature  sampling temperature in [0, 1]
 */
public record ReasoningRequest(
    String agentType,
    String systemPrompt,
    String input,
    String sessionId,
    double temperature
) {}
