package com.agenthub.orchestrator.session;

import com.agenthub.common.exception.SessionBusyException;
import com.agenthub.common.exception.SessionNotFoundException;
import com.agenthub.common.model.AgentResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All sessions known to this process, keyed by session id.
 *
 * <p>Sessions are independent: each record carries its own lock and nothing here blocks across
 * sessions. Records are created by the first submitted turn and live until deleted; attaching
 * to an id that has never received a message fails with {@link SessionNotFoundException}.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    // ── turn lifecycle (driven by RequestCoordinator) ─────────────────────────

    /**
     * Puts the session in flight for {@code turnId} and clears its buffer.
     *
     * @return {@code false} when another turn is still running
     */
    public boolean beginTurn(String sessionId, String turnId) {
        while (true) {
            SessionRecord record = recordFor(sessionId);
            boolean started = record.begin(turnId, clock.instant());
            // a concurrent delete may have closed the record we just fetched
            if (!record.isDeleted()) {
                return started;
            }
            sessions.remove(sessionId, record);
        }
    }

    public void appendFragment(String sessionId, String turnId, String fragment) {
        SessionRecord record = sessions.get(sessionId);
        if (record != null) {
            record.append(turnId, fragment, clock.instant());
        }
    }

    public void completeTurn(String sessionId, String turnId, AgentResponse response, String agentType) {
        SessionRecord record = sessions.get(sessionId);
        if (record == null || !record.complete(turnId, response, agentType, clock.instant())) {
            log.warn("[SessionRegistry] Ignored completion of stale turn. sessionId={} turnId={}", sessionId, turnId);
        }
    }

    // ── observers ─────────────────────────────────────────────────────────────

    /**
     * Replays buffered output to {@code observer}, then forwards live output until detached.
     *
     * @throws SessionNotFoundException for an unknown id
     */
    public SessionAttachment attach(String sessionId, SessionObserver observer) {
        SessionAttachment attachment = require(sessionId).attach(observer);
        log.debug("[SessionRegistry] Observer attached. sessionId={}", sessionId);
        return attachment;
    }

    /**
     * Reactive view of one attachment: buffered and live fragments, then the turn's response,
     * then completion. Cancelling the subscription detaches; the turn itself keeps running.
     * An unknown id errors the stream with {@link SessionNotFoundException}.
     */
    public Flux<SessionEvent> stream(String sessionId) {
        return Flux.create(sink -> {
            SinkObserver observer = new SinkObserver(sink);
            SessionAttachment attachment = attach(sessionId, observer);
            if (observer.done) {
                // replay already delivered the terminal event
                attachment.detach();
            } else {
                sink.onDispose(attachment::detach);
            }
        });
    }

    // ── queries and administration ────────────────────────────────────────────

    public Optional<SessionStatus> status(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(SessionRecord::status);
    }

    /** Most recently active first. */
    public List<SessionStatus> statuses() {
        return sessions.values().stream()
            .map(SessionRecord::status)
            .sorted(Comparator.comparing(SessionStatus::lastActivityAt).reversed())
            .toList();
    }

    public boolean isInFlight(String sessionId) {
        SessionRecord record = sessions.get(sessionId);
        return record != null && record.isInFlight();
    }

    public boolean hasUnseenOutput(String sessionId) {
        return status(sessionId).map(SessionStatus::hasUnseenOutput).orElse(false);
    }

    public List<String> bufferedOutput(String sessionId) {
        return require(sessionId).bufferSnapshot();
    }

    public Optional<AgentResponse> lastResponse(String sessionId) {
        return Optional.ofNullable(require(sessionId).lastResponse());
    }

    public void acknowledge(String sessionId) {
        require(sessionId).acknowledge();
    }

    /**
     * Removes the session and closes its observers.
     *
     * @throws SessionBusyException     while a turn is running
     * @throws SessionNotFoundException for an unknown id
     */
    public void delete(String sessionId) {
        SessionRecord record = require(sessionId);
        if (!record.close()) {
            throw new SessionBusyException(sessionId);
        }
        sessions.remove(sessionId, record);
        log.info("[SessionRegistry] Session deleted. sessionId={}", sessionId);
    }

    public int size() {
        return sessions.size();
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private SessionRecord recordFor(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.info("[SessionRegistry] Session created. sessionId={}", id);
            return new SessionRecord(id, clock.instant());
        });
    }

    private SessionRecord require(String sessionId) {
        SessionRecord record = sessions.get(sessionId);
        if (record == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return record;
    }

    /** Bridges observer callbacks into a {@link FluxSink}; completes on the first terminal event. */
    private static final class SinkObserver implements SessionObserver {

        private final FluxSink<SessionEvent> sink;
        private volatile boolean done;

        SinkObserver(FluxSink<SessionEvent> sink) {
            this.sink = sink;
        }

        @Override
        public void onFragment(String fragment) {
            sink.next(SessionEvent.fragment(fragment));
        }

        @Override
        public void onTurnComplete(AgentResponse response) {
            done = true;
            sink.next(SessionEvent.complete(response));
            sink.complete();
        }

        @Override
        public void onClosed() {
            done = true;
            sink.complete();
        }
    }
}
