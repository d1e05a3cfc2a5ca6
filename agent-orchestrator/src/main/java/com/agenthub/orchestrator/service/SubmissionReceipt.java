package com.agenthub.orchestrator.service;

import com.agenthub.common.model.AgentResponse;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Returned as soon as a message is accepted. The turn runs in the background;
 * {@code response} completes with its outcome, success or failure, and never errors.
 */
@JsonIgnoreProperties("response")
public record SubmissionReceipt(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("turnId") String turnId,
    @JsonProperty("acceptedAt") Instant acceptedAt,
    Mono<AgentResponse> response
) {}
