package com.agenthub.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record AgentResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("agentType") String agentType,
    @JsonProperty("content") String content,
    @JsonProperty("success") boolean success,
    @JsonProperty("errorKind") ErrorKind errorKind,       // null on success
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public AgentResponse {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AgentResponse of(String sessionId, String agentType, String content,
                                   Map<String, Object> metadata) {
        return new AgentResponse(sessionId, agentType, content, true, null, Instant.now(), metadata);
    }

    /**
     * Error turn attributed to {@code sessionId}. {@code agentType} may be null when the
     * failure happened before an agent was resolved.
     */
    public static AgentResponse failure(String sessionId, String agentType,
                                        ErrorKind kind, String reason) {
        String content = "I apologize, but I encountered an error processing your request: " + reason;
        return new AgentResponse(sessionId, agentType, content, false, kind, Instant.now(),
            Map.of("agent", agentType != null ? agentType : "error-handler", "error", true));
    }
}
