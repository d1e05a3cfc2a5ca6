package com.agenthub.common.exception;

/**
 * Raised when an agent factory cannot build an instance for an agent type.
 * The cache is left untouched when this is thrown.
 */
public class AgentConstructionException extends AgentException {

    public AgentConstructionException(String agentType, String message) {
        super(agentType, message);
    }

    public AgentConstructionException(String agentType, String message, Throwable cause) {
        super(agentType, message, cause);
    }

    public String getAgentType() {
        return getSubject();
    }
}
