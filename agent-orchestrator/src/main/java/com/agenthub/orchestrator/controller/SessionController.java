package com.agenthub.orchestrator.controller;

import com.agenthub.common.exception.SessionNotFoundException;
import com.agenthub.orchestrator.service.RequestCoordinator;
import com.agenthub.orchestrator.service.SubmissionReceipt;
import com.agenthub.orchestrator.session.SessionEvent;
import com.agenthub.orchestrator.session.SessionRegistry;
import com.agenthub.orchestrator.session.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final RequestCoordinator requestCoordinator;
    private final SessionRegistry sessionRegistry;

    public SessionController(RequestCoordinator requestCoordinator, SessionRegistry sessionRegistry) {
        this.requestCoordinator = requestCoordinator;
        this.sessionRegistry    = sessionRegistry;
    }

    /** 202 with the receipt; the answer arrives on {@code /stream}. */
    @PostMapping("/{sessionId}/messages")
    public ResponseEntity<SubmissionReceipt> submit(@PathVariable String sessionId,
                                                    @RequestBody MessageRequest request) {
        SubmissionReceipt receipt = requestCoordinator.submit(sessionId, request == null ? null : request.input());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(receipt);
    }

    /** Buffered fragments first, then live ones, then one {@code complete} event. */
    @GetMapping(value = "/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SessionEvent>> stream(@PathVariable String sessionId) {
        if (sessionRegistry.status(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("[SessionController] SSE client attached. sessionId={}", sessionId);
        return sessionRegistry.stream(sessionId)
            .map(event -> ServerSentEvent.<SessionEvent>builder()
                .event(event.isTerminal() ? "complete" : "fragment")
                .data(event)
                .build());
    }

    @GetMapping
    public List<SessionStatus> sessions() {
        return sessionRegistry.statuses();
    }

    @GetMapping("/{sessionId}")
    public SessionStatus session(@PathVariable String sessionId) {
        return sessionRegistry.status(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @PostMapping("/{sessionId}/ack")
    public SessionStatus acknowledge(@PathVariable String sessionId) {
        sessionRegistry.acknowledge(sessionId);
        return session(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> delete(@PathVariable String sessionId) {
        sessionRegistry.delete(sessionId);
        return ResponseEntity.noContent().build();
    }
}
