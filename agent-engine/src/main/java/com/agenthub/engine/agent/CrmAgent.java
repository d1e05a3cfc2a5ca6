package com.agenthub.engine.agent;

import com.agenthub.engine.reasoning.ReasoningClient;

/**
 * Customer-relationship questions: contacts, leads, opportunities and pipeline status.
 * Tool calls into the CRM system happen inside the reasoning provider and are opaque here.
 */
public class CrmAgent extends SpecializedLlmAgent {

    public static final String TYPE = "crm";

    private static final String SYSTEM_PROMPT = """
        You are a CRM assistant. Answer questions about contacts, leads, opportunities and \
        sales pipeline stages. Summarise records as short lists and never invent customer data.""";

    public CrmAgent(ReasoningClient reasoningClient) {
        super(reasoningClient);
    }

    @Override
    public String agentType() { return TYPE; }

    @Override
    protected String systemPrompt() { return SYSTEM_PROMPT; }
}
