package com.agenthub.common.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentTypesTest {

    @Test
    @DisplayName("case, whitespace and agent suffixes collapse to one canonical name")
    void variantsCollapse() {
        assertEquals("technical", AgentTypes.normalize("technical"));
        assertEquals("technical", AgentTypes.normalize("  Technical "));
        assertEquals("technical", AgentTypes.normalize("TechnicalAgent"));
        assertEquals("technical", AgentTypes.normalize("technical-agent"));
        assertEquals("technical", AgentTypes.normalize("technical_agent"));
    }

    @Test
    @DisplayName("a bare 'agent' type is kept as is")
    void bareAgentKept() {
        assertEquals("agent", AgentTypes.normalize("Agent"));
    }

    @Test
    @DisplayName("null or blank types are rejected")
    void blankRejected() {
        assertThrows(IllegalArgumentException.class, () -> AgentTypes.normalize(null));
        assertThrows(IllegalArgumentException.class, () -> AgentTypes.normalize("   "));
        assertThrows(IllegalArgumentException.class, () -> AgentTypes.normalize("-agent"));
    }
}
