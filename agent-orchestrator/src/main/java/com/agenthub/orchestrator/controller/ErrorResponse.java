package com.agenthub.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    @JsonProperty("status") int status,
    @JsonProperty("error") String error,
    @JsonProperty("message") String message
) {}
