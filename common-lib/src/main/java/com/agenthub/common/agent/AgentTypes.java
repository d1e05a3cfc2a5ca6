package com.agenthub.common.agent;

import java.util.Locale;

/**
 * Canonical form of agent type names, so {@code "TechnicalAgent"}, {@code " technical "}
 * and {@code "technical-agent"} share a single cache entry.
 */
public final class AgentTypes {

    private static final String SUFFIX = "agent";

    private AgentTypes() {}

    public static String normalize(String agentType) {
        if (agentType == null) {
            throw new IllegalArgumentException("agentType must not be null");
        }
        String normalized = agentType.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > SUFFIX.length() && normalized.endsWith(SUFFIX)) {
            normalized = normalized.substring(0, normalized.length() - SUFFIX.length());
            while (normalized.endsWith("-") || normalized.endsWith("_") || normalized.endsWith(" ")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("agentType must not be blank");
        }
        return normalized;
    }
}
