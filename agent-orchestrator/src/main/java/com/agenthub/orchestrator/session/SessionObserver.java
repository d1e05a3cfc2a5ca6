package com.agenthub.orchestrator.session;

import com.agenthub.common.model.AgentResponse;

/**
 * Receives one session's output. Callbacks arrive in order, on whichever thread produced the
 * fragment, while the session's lock is held, so implementations must return quickly.
 * An observer that throws is detached.
 */
public interface SessionObserver {

    void onFragment(String fragment);

    /** Called once per finished turn, successful or not. */
    default void onTurnComplete(AgentResponse response) { }

    /** The session was deleted; no further callbacks follow. */
    default void onClosed() { }
}
