package com.agenthub.common.exception;

/**
 * A session already has a request in flight. Never queued: the caller decides what to do.
 */
public class SessionBusyException extends AgentException {

    public SessionBusyException(String sessionId) {
        super(sessionId, "Session is still processing a previous message");
    }

    public String getSessionId() {
        return getSubject();
    }
}
