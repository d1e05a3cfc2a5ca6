package com.agenthub.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code agenthub.*}. Defaults apply when a key is absent.
 */
@ConfigurationProperties(prefix = "agenthub")
public class AgentHubProperties {

    private final Cache cache = new Cache();
    private final Selection selection = new Selection();
    private final Session session = new Session();
    private final Reasoning reasoning = new Reasoning();

    public Cache getCache() {
        return cache;
    }

    public Selection getSelection() {
        return selection;
    }

    public Session getSession() {
        return session;
    }

    public Reasoning getReasoning() {
        return reasoning;
    }

    public static class Cache {

        private int capacity = 3;
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(10);

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Selection {

        private String defaultAgentType = "analytical";
        private List<String> priorityOrder = new ArrayList<>();

        /** Agent type → trigger terms. */
        private Map<String, List<String>> triggers = new LinkedHashMap<>();

        /** Below this confidence the default type answers instead of the selected one. */
        private double confidenceThreshold = 0.3;
        private boolean hybridFallback = true;

        /** Retried once when the selected type fails to construct. Blank disables the retry. */
        private String fallbackAgentType = "analytical";

        public String getDefaultAgentType() {
            return defaultAgentType;
        }

        public void setDefaultAgentType(String defaultAgentType) {
            this.defaultAgentType = defaultAgentType;
        }

        public List<String> getPriorityOrder() {
            return priorityOrder;
        }

        public void setPriorityOrder(List<String> priorityOrder) {
            this.priorityOrder = priorityOrder;
        }

        public Map<String, List<String>> getTriggers() {
            return triggers;
        }

        public void setTriggers(Map<String, List<String>> triggers) {
            this.triggers = triggers;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public boolean isHybridFallback() {
            return hybridFallback;
        }

        public void setHybridFallback(boolean hybridFallback) {
            this.hybridFallback = hybridFallback;
        }

        public String getFallbackAgentType() {
            return fallbackAgentType;
        }

        public void setFallbackAgentType(String fallbackAgentType) {
            this.fallbackAgentType = fallbackAgentType;
        }
    }

    public static class Session {

        private Duration turnTimeout = Duration.ofMinutes(2);

        public Duration getTurnTimeout() {
            return turnTimeout;
        }

        public void setTurnTimeout(Duration turnTimeout) {
            this.turnTimeout = turnTimeout;
        }
    }

    public static class Reasoning {

        /** Empty → offline replies, no network calls. */
        private String apiKey = "";
        private String baseUrl = "https://api.anthropic.com";
        private String model = "claude-haiku-4-5-20251001";
        private int maxTokens = 1024;
        private Duration timeout = Duration.ofSeconds(60);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
