package com.agenthub.orchestrator.session;

import com.agenthub.common.model.AgentResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One item of {@link SessionRegistry#stream}: either a fragment or the turn's terminal response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionEvent(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("fragment") String fragment,
    @JsonProperty("response") AgentResponse response
) {
    public enum Kind { FRAGMENT, COMPLETE }

    public static SessionEvent fragment(String fragment) {
        return new SessionEvent(Kind.FRAGMENT, fragment, null);
    }

    public static SessionEvent complete(AgentResponse response) {
        return new SessionEvent(Kind.COMPLETE, null, response);
    }

    public boolean isTerminal() {
        return kind == Kind.COMPLETE;
    }
}
