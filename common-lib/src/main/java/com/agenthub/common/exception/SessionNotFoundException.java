package com.agenthub.common.exception;

public class SessionNotFoundException extends AgentException {

    public SessionNotFoundException(String sessionId) {
        super(sessionId, "Unknown session");
    }
}
