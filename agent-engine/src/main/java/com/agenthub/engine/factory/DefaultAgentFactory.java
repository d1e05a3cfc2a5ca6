package com.agenthub.engine.factory;

import com.agenthub.common.agent.Agent;
import com.agenthub.common.agent.AgentFactory;
import com.agenthub.common.agent.AgentTypes;
import com.agenthub.common.exception.AgentConstructionException;
import com.agenthub.engine.agent.AnalyticalAgent;
import com.agenthub.engine.agent.CreativeAgent;
import com.agenthub.engine.agent.CrmAgent;
import com.agenthub.engine.agent.TechnicalAgent;
import com.agenthub.engine.reasoning.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds the four LLM-backed agent types around one shared {@link ReasoningClient}.
 *
 * <p>Any failure inside a constructor surfaces as {@link AgentConstructionException};
 * an unknown type is a construction failure too, so the dispatcher can apply its fallback.
 */
public class DefaultAgentFactory implements AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultAgentFactory.class);

    private final ReasoningClient reasoningClient;
    private final Map<String, Function<ReasoningClient, Agent>> constructors = new LinkedHashMap<>();

    public DefaultAgentFactory(ReasoningClient reasoningClient) {
        this.reasoningClient = reasoningClient;
        constructors.put(AnalyticalAgent.TYPE, AnalyticalAgent::new);
        constructors.put(CreativeAgent.TYPE,   CreativeAgent::new);
        constructors.put(TechnicalAgent.TYPE,  TechnicalAgent::new);
        constructors.put(CrmAgent.TYPE,        CrmAgent::new);
    }

    @Override
    public Agent create(String agentType) {
        String type = AgentTypes.normalize(agentType);
        Function<ReasoningClient, Agent> constructor = constructors.get(type);
        if (constructor == null) {
            throw new AgentConstructionException(type, "Unknown agent type. supported=" + supportedTypes());
        }

        long startTime = System.currentTimeMillis();
        Agent agent;
        try {
            agent = constructor.apply(reasoningClient);
        } catch (RuntimeException e) {
            log.error("[AgentFactory] Failed to create agentType={}", type, e);
            throw new AgentConstructionException(type, "Construction failed: " + e.getMessage(), e);
        }
        log.info("[AgentFactory] Created agentType={} in {}ms", type, System.currentTimeMillis() - startTime);
        return agent;
    }

    @Override
    public List<String> supportedTypes() {
        return List.copyOf(constructors.keySet());
    }
}
