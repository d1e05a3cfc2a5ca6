package com.agenthub.orchestrator.cache;

/**
 * Observes cache lifecycle events. Called outside the cache's internal locks;
 * implementations must be thread-safe and fast.
 */
public interface AgentCacheListener {

    void onCreated(String agentType);

    void onEvicted(String agentType, EvictionCause cause);
}
