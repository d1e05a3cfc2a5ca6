package com.agenthub.orchestrator.cache;

import java.time.Instant;

/**
 * Read-only view of one cache entry for stats export.
 */
public record CacheEntrySnapshot(
    String agentType,
    long useCount,
    Instant createdAt,
    Instant lastUsedAt
) {}
