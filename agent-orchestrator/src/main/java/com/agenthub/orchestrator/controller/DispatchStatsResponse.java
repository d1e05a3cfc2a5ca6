package com.agenthub.orchestrator.controller;

import com.agenthub.orchestrator.cache.CacheEntrySnapshot;
import com.agenthub.orchestrator.dispatch.DispatchStatsSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DispatchStatsResponse(
    @JsonProperty("stats") DispatchStatsSnapshot stats,
    @JsonProperty("cacheSize") int cacheSize,
    @JsonProperty("cacheCapacity") int cacheCapacity,
    @JsonProperty("cachedAgents") List<CacheEntrySnapshot> cachedAgents,   // most recently used first
    @JsonProperty("availableAgentTypes") List<String> availableAgentTypes
) {}
