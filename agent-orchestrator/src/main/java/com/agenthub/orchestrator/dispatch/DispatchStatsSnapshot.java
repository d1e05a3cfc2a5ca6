package com.agenthub.orchestrator.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DispatchStatsSnapshot(
    @JsonProperty("totalDispatches") long totalDispatches,
    @JsonProperty("created") long created,
    @JsonProperty("evicted") long evicted,
    @JsonProperty("hits") long hits,
    @JsonProperty("misses") long misses,
    @JsonProperty("hitRate") double hitRate,                 // percent, 0.0 before the first lookup
    @JsonProperty("lowConfidenceFallbacks") long lowConfidenceFallbacks,
    @JsonProperty("constructionFallbacks") long constructionFallbacks,
    @JsonProperty("constructionFailures") long constructionFailures,
    @JsonProperty("avgResponseTimeMs") double avgResponseTimeMs,
    @JsonProperty("responseSamples") int responseSamples
) {}
