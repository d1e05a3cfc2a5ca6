package com.agenthub.orchestrator.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SessionStatus(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("inFlight") boolean inFlight,
    @JsonProperty("hasUnseenOutput") boolean hasUnseenOutput,
    @JsonProperty("lastAgentType") String lastAgentType,      // null before the first completed turn
    @JsonProperty("bufferedFragments") int bufferedFragments,
    @JsonProperty("attachedObservers") int attachedObservers,
    @JsonProperty("completedTurns") long completedTurns,
    @JsonProperty("failedTurns") long failedTurns,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("lastActivityAt") Instant lastActivityAt
) {}
