package com.agenthub.common.exception;

/**
 * Root of the dispatch-core exception hierarchy.
 *
 * <p>The {@code subject} is the agent type or session id the failure belongs to; it is
 * prefixed to the message so log lines stay attributable without extra context.
 */
public class AgentException extends RuntimeException {
    private final String subject;

    public AgentException(String subject, String message) {
        super("[" + subject + "] " + message);
        this.subject = subject;
    }

    public AgentException(String subject, String message, Throwable cause) {
        super("[" + subject + "] " + message, cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
