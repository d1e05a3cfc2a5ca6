package com.agenthub.orchestrator.dispatch;

import com.agenthub.common.agent.Agent;
import com.agenthub.common.model.SelectionResult;

/**
 * The agent instance that will answer a turn, plus how it was chosen.
 *
 * @param agentType the type actually served; differs from {@code selection.agentType()} only
 *                  when a construction fallback kicked in
 * @param created   {@code true} when this dispatch constructed the instance
 */
public record DispatchResult(
    Agent agent,
    String agentType,
    SelectionResult selection,
    boolean created
) {}
