package com.agenthub.common.agent;

import com.agenthub.common.exception.AgentConstructionException;

import java.util.List;

/**
 * Builds agent instances on a cache miss. Construction may be expensive (client setup,
 * tool wiring) and may fail.
 */
public interface AgentFactory {

    /**
     * @throws AgentConstructionException when the type is unknown or construction fails
     */
    Agent create(String agentType);

    List<String> supportedTypes();
}
