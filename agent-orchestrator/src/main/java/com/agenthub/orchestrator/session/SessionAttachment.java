package com.agenthub.orchestrator.session;

/**
 * Handle returned by {@link SessionRegistry#attach}. Detaching stops delivery to that observer
 * only; the session's running turn continues and keeps buffering.
 */
@FunctionalInterface
public interface SessionAttachment {

    void detach();
}
