package com.agenthub.orchestrator.cache;

import com.agenthub.common.agent.Agent;

/**
 * Result of {@link AgentCache#get(String)}.
 *
 * @param created {@code true} when this call constructed the instance (a miss)
 */
public record CacheLookup(String agentType, Agent agent, boolean created) {}
