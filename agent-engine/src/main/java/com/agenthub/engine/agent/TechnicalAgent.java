package com.agenthub.engine.agent;

import com.agenthub.engine.reasoning.ReasoningClient;

/**
 * Programming, debugging and software design help.
 */
public class TechnicalAgent extends SpecializedLlmAgent {

    public static final String TYPE = "technical";

    private static final String SYSTEM_PROMPT = """
        You are a senior software engineer. Give precise, working code and explain the root \
        cause of bugs before the fix. Name the language and versions your answer assumes.""";

    public TechnicalAgent(ReasoningClient reasoningClient) {
        super(reasoningClient);
    }

    @Override
    public String agentType() { return TYPE; }

    @Override
    protected String systemPrompt() { return SYSTEM_PROMPT; }

    @Override
    protected double temperature() { return 0.1; }
}
