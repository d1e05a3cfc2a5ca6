package com.agenthub.engine.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reasoning provider backed by the Anthropic Messages API in streaming mode.
 *
 * <p><strong>Reactive contract</strong>: fully non-blocking. The request is a {@code Mono}
 * of the serialised body flat-mapped into the server-sent event stream; each
 * {@code content_block_delta} event becomes one text fragment. No {@code .block()} anywhere.
 *
 * <p><strong>Fallback behaviour</strong>: with no API key configured every request is
 * answered by a deterministic offline reply, streamed word by word, so a deployment without
 * credentials still exercises the whole dispatch path. Provider errors are not masked: they
 * propagate to the agent, which reports a failed turn.
 */
public class AnthropicReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReasoningClient.class);

    static final String DELTA_EVENT = "content_block_delta";
    static final String ERROR_EVENT = "error";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final ReasoningSettings settings;

    public AnthropicReasoningClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                    ReasoningSettings settings) {
        this.anthropicClient = builder
            .baseUrl(settings.baseUrl())
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.settings     = settings;
    }

    @Override
    public Flux<String> stream(ReasoningRequest request) {
        if (!settings.hasApiKey()) {
            log.warn("[Reasoning] No Anthropic API key configured — returning offline reply. agentType={} sessionId={}",
                     request.agentType(), request.sessionId());
            return Flux.fromIterable(offlineReply(request));
        }

        log.info("[Reasoning] Streaming request. agentType={} model={} sessionId={}",
                 request.agentType(), settings.model(), request.sessionId());

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(request)))
            .flatMapMany(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", settings.apiKey())
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToFlux(SSE_TYPE)
                    .timeout(settings.idleTimeout()))
            .handle((event, sink) -> {
                if (ERROR_EVENT.equals(event.event())) {
                    sink.error(new IllegalStateException("Provider error: " + event.data()));
                    return;
                }
                if (DELTA_EVENT.equals(event.event())) {
                    String text = extractDelta(event.data());
                    if (!text.isEmpty()) {
                        sink.next(text);
                    }
                }
            });
    }

    // ── wire format ───────────────────────────────────────────────────────────

    Map<String, Object> requestBody(ReasoningRequest request) {
        return Map.of(
            "model", settings.model(),
            "max_tokens", settings.maxTokens(),
            "stream", true,
            "temperature", request.temperature(),
            "system", request.systemPrompt(),
            "messages", List.of(Map.of("role", "user", "content", request.input()))
        );
    }

    /**
     * Pulls {@code delta.text} out of one {@code content_block_delta} payload.
     * Non-text deltas (tool input JSON) yield an empty string.
     */
    String extractDelta(String data) {
        if (data == null || data.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(data);
            return root.path("delta").path("text").asText("");
        } catch (Exception e) {
            throw new IllegalStateException("Failed to extract text from streamed event", e);
        }
    }

    // ── offline fallback ──────────────────────────────────────────────────────

    /**
     * Deterministic reply used when no provider is configured. Split into word fragments
     * (each keeps its trailing space) so observers see a realistic stream.
     */
    static List<String> offlineReply(ReasoningRequest request) {
        String text = String.format(
            "The %s agent received your message (%d characters). "
                + "No reasoning provider is configured, so this is an offline acknowledgement.",
            request.agentType(), request.input() == null ? 0 : request.input().length());

        String[] words = text.split(" ");
        List<String> fragments = new ArrayList<>(words.length);
        for (int i = 0; i < words.length; i++) {
            fragments.add(i < words.length - 1 ? words[i] + " " : words[i]);
        }
        return fragments;
    }
}
