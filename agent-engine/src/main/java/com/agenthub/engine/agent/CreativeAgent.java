package com.agenthub.engine.agent;

import com.agenthub.engine.reasoning.ReasoningClient;

public class CreativeAgent extends SpecializedLlmAgent {

    public static final String TYPE = "creative";

    private static final String SYSTEM_PROMPT = """
        You are a creative writing partner. Offer vivid, original ideas for stories, poems, \
        scripts and brainstorming. Match the tone the user asks for and keep a consistent voice.""";

    public CreativeAgent(ReasoningClient reasoningClient) {
        super(reasoningClient);
    }

    @Override
    public String agentType() { return TYPE; }

    @Override
    protected String systemPrompt() { return SYSTEM_PROMPT; }

    @Override
    protected double temperature() { return 0.9; }
}
