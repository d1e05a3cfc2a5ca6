package com.agenthub.common.exception;

import java.time.Duration;

/**
 * An agent's own call failed, or did not finish within the turn timeout.
 */
public class AgentProcessingException extends AgentException {
    private final boolean timedOut;

    public AgentProcessingException(String agentType, String message, Throwable cause) {
        this(agentType, message, cause, false);
    }

    private AgentProcessingException(String agentType, String message, Throwable cause, boolean timedOut) {
        super(agentType, message, cause);
        this.timedOut = timedOut;
    }

    public static AgentProcessingException timeout(String agentType, Duration limit, Throwable cause) {
        return new AgentProcessingException(agentType,
            "No response within " + limit.toMillis() + "ms", cause, true);
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
