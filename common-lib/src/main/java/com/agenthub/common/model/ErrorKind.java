package com.agenthub.common.model;

/**
 * Why a turn failed. Surfaced on {@link AgentResponse#errorKind()} for failed turns only.
 */
public enum ErrorKind {
    /** Agent factory could not build the selected type (or its fallback). */
    CONSTRUCTION,
    /** The agent's own call failed. */
    PROCESSING,
    /** The agent did not answer within the turn timeout. */
    TIMEOUT
}
