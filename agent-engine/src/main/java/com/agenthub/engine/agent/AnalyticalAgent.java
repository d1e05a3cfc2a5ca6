package com.agenthub.engine.agent;

import com.agenthub.engine.reasoning.ReasoningClient;

/**
 * Data analysis, statistics and research questions. Also the default type when the
 * selector finds nothing specific.
 */
public class AnalyticalAgent extends SpecializedLlmAgent {

    public static final String TYPE = "analytical";

    private static final String SYSTEM_PROMPT = """
        You are an analytical assistant. Break problems into measurable parts, \
        show the calculation or evidence behind every claim, and state your assumptions. \
        When data is missing, say what would be needed instead of guessing.""";

    public AnalyticalAgent(ReasoningClient reasoningClient) {
        super(reasoningClient);
    }

    @Override
    public String agentType() { return TYPE; }

    @Override
    protected String systemPrompt() { return SYSTEM_PROMPT; }

    @Override
    protected double temperature() { return 0.2; }
}
