package com.agenthub.orchestrator;

import com.agenthub.orchestrator.cache.AgentCache;
import com.agenthub.orchestrator.config.AgentHubProperties;
import com.agenthub.orchestrator.dispatch.AgentDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class AgentHubApplicationTest {

    @Autowired
    private AgentHubProperties properties;

    @Autowired
    private AgentCache agentCache;

    @Autowired
    private AgentDispatcher agentDispatcher;

    @Test
    void bindsConfigurationAndWiresDispatchStack() {
        assertEquals(3, agentCache.capacity());
        assertEquals(Duration.ofMinutes(30), properties.getCache().getIdleTimeout());
        assertEquals(Duration.ofMinutes(2), properties.getSession().getTurnTimeout());
        assertEquals(4, agentDispatcher.availableAgentTypes().size());
        assertEquals("creative", agentDispatcher.preview("please write a creative poem").agentType());
    }
}
