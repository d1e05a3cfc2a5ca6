package com.agenthub.orchestrator.cache;

public enum EvictionCause {
    /** Least-recently-used entry removed to make room for a new type. */
    CAPACITY,
    /** Unused for longer than the idle timeout. */
    IDLE,
    /** Administrative removal. */
    MANUAL,
    /** Cache cleared at process shutdown. */
    SHUTDOWN
}
