package com.agenthub.orchestrator.config;

import com.agenthub.common.agent.AgentFactory;
import com.agenthub.common.selector.AgentSelector;
import com.agenthub.engine.factory.DefaultAgentFactory;
import com.agenthub.engine.reasoning.AnthropicReasoningClient;
import com.agenthub.engine.reasoning.ReasoningClient;
import com.agenthub.engine.reasoning.ReasoningSettings;
import com.agenthub.orchestrator.cache.AgentCache;
import com.agenthub.orchestrator.dispatch.AgentDispatcher;
import com.agenthub.orchestrator.logger.TurnFlowLogger;
import com.agenthub.orchestrator.service.RequestCoordinator;
import com.agenthub.orchestrator.session.SessionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the dispatch stack. Every collaborator is constructor-injected; nothing in the
 * cache, dispatcher or session layer is a singleton of its own.
 */
@Configuration
@EnableConfigurationProperties(AgentHubProperties.class)
public class AgentHubConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ReasoningClient reasoningClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                           AgentHubProperties properties) {
        AgentHubProperties.Reasoning reasoning = properties.getReasoning();
        return new AnthropicReasoningClient(builder, objectMapper, new ReasoningSettings(
            reasoning.getApiKey(), reasoning.getBaseUrl(), reasoning.getModel(),
            reasoning.getMaxTokens(), reasoning.getTimeout()));
    }

    @Bean
    public AgentFactory agentFactory(ReasoningClient reasoningClient) {
        return new DefaultAgentFactory(reasoningClient);
    }

    @Bean
    public AgentSelector agentSelector(AgentHubProperties properties) {
        AgentHubProperties.Selection selection = properties.getSelection();
        return new AgentSelector(selection.getTriggers(), selection.getPriorityOrder(),
            selection.getDefaultAgentType());
    }

    @Bean(destroyMethod = "clear")
    public AgentCache agentCache(AgentFactory agentFactory, AgentHubProperties properties, Clock clock) {
        AgentHubProperties.Cache cache = properties.getCache();
        return new AgentCache(agentFactory, cache.getCapacity(), cache.getIdleTimeout(), clock);
    }

    @Bean
    public AgentDispatcher agentDispatcher(AgentSelector agentSelector, AgentCache agentCache,
                                           AgentHubProperties properties) {
        AgentHubProperties.Selection selection = properties.getSelection();
        return new AgentDispatcher(agentSelector, agentCache, selection.getConfidenceThreshold(),
            selection.isHybridFallback(), selection.getFallbackAgentType());
    }

    @Bean
    public SessionRegistry sessionRegistry(Clock clock) {
        return new SessionRegistry(clock);
    }

    @Bean
    public TurnFlowLogger turnFlowLogger() {
        return new TurnFlowLogger();
    }

    @Bean
    public RequestCoordinator requestCoordinator(SessionRegistry sessionRegistry, AgentDispatcher agentDispatcher,
                                                 TurnFlowLogger turnFlowLogger, AgentHubProperties properties,
                                                 Clock clock) {
        return new RequestCoordinator(sessionRegistry, agentDispatcher,
            properties.getSession().getTurnTimeout(), turnFlowLogger, clock);
    }
}
