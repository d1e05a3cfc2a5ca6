package com.agenthub.orchestrator.session;

import com.agenthub.common.model.AgentResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * State of one session. Every field is guarded by the record's own monitor, so buffer appends,
 * observer registration and replay can never interleave: an observer attaching mid-turn sees
 * the whole buffer, then exactly the fragments appended after it, in order.
 */
final class SessionRecord {

    private static final Logger log = LoggerFactory.getLogger(SessionRecord.class);

    private final String sessionId;
    private final Instant createdAt;

    private final List<String> buffer = new ArrayList<>();
    private final List<SessionObserver> observers = new ArrayList<>();

    private boolean inFlight;
    private boolean hasUnseenOutput;
    private boolean deleted;
    private String currentTurnId;
    private String lastAgentType;
    private AgentResponse lastResponse;
    private Instant lastActivityAt;
    private long completedTurns;
    private long failedTurns;

    SessionRecord(String sessionId, Instant now) {
        this.sessionId      = sessionId;
        this.createdAt      = now;
        this.lastActivityAt = now;
    }

    // ── turn lifecycle ────────────────────────────────────────────────────────

    /**
     * Idle → InFlight. Returns {@code false} when a turn is already running; the running turn
     * is left untouched. The previous turn's output is discarded, and with it any unseen flag.
     */
    synchronized boolean begin(String turnId, Instant now) {
        if (inFlight) {
            return false;
        }
        inFlight        = true;
        currentTurnId   = turnId;
        lastResponse    = null;
        lastActivityAt  = now;
        hasUnseenOutput = false;
        buffer.clear();
        return true;
    }

    /** Appends and forwards one fragment. Fragments of any other turn are dropped. */
    synchronized boolean append(String turnId, String fragment, Instant now) {
        if (!inFlight || !turnId.equals(currentTurnId)) {
            log.debug("[Session] Dropped stale fragment sessionId={} turnId={} currentTurnId={}",
                      sessionId, turnId, currentTurnId);
            return false;
        }
        buffer.add(fragment);
        lastActivityAt = now;
        deliver(observer -> observer.onFragment(fragment));
        return true;
    }

    /** InFlight → Idle. Marks the output unseen when nobody is attached. */
    synchronized boolean complete(String turnId, AgentResponse response, String agentType, Instant now) {
        if (!inFlight || !turnId.equals(currentTurnId)) {
            return false;
        }
        inFlight       = false;
        lastResponse   = response;
        lastActivityAt = now;
        if (agentType != null) {
            lastAgentType = agentType;
        }
        if (response.success()) {
            completedTurns++;
        } else {
            failedTurns++;
        }

        hasUnseenOutput = observers.isEmpty();
        if (!hasUnseenOutput) {
            deliver(observer -> observer.onTurnComplete(response));
        }
        return true;
    }

    // ── observers ─────────────────────────────────────────────────────────────

    /**
     * Registers {@code observer} after replaying the current buffer to it. When the last turn
     * has already finished its response is replayed too and the output counts as seen.
     */
    synchronized SessionAttachment attach(SessionObserver observer) {
        try {
            for (String fragment : buffer) {
                observer.onFragment(fragment);
            }
            if (!inFlight && lastResponse != null) {
                observer.onTurnComplete(lastResponse);
                hasUnseenOutput = false;
            }
        } catch (RuntimeException e) {
            log.warn("[Session] Observer failed during replay, not attached. sessionId={}", sessionId, e);
            return () -> { };
        }
        if (deleted) {
            observer.onClosed();
            return () -> { };
        }
        observers.add(observer);
        return () -> detach(observer);
    }

    synchronized void detach(SessionObserver observer) {
        observers.remove(observer);
    }

    synchronized void acknowledge() {
        hasUnseenOutput = false;
    }

    /**
     * Marks the record deleted and closes its observers. Returns {@code false} while a turn is
     * running.
     */
    synchronized boolean close() {
        if (inFlight) {
            return false;
        }
        deleted = true;
        List<SessionObserver> closing = new ArrayList<>(observers);
        observers.clear();
        for (SessionObserver observer : closing) {
            try {
                observer.onClosed();
            } catch (RuntimeException e) {
                log.warn("[Session] Observer failed on close. sessionId={}", sessionId, e);
            }
        }
        return true;
    }

    synchronized boolean isDeleted() {
        return deleted;
    }

    synchronized boolean isInFlight() {
        return inFlight;
    }

    synchronized List<String> bufferSnapshot() {
        return List.copyOf(buffer);
    }

    synchronized AgentResponse lastResponse() {
        return lastResponse;
    }

    synchronized SessionStatus status() {
        return new SessionStatus(sessionId, inFlight, hasUnseenOutput, lastAgentType, buffer.size(),
            observers.size(), completedTurns, failedTurns, createdAt, lastActivityAt);
    }

    // ── internals ─────────────────────────────────────────────────────────────

    /**
     * Caller holds the monitor. Iterates a copy because an observer may detach itself from
     * inside its callback. A throwing observer is detached and the rest still receive.
     */
    private void deliver(Consumer<SessionObserver> call) {
        List<SessionObserver> failed = null;
        for (SessionObserver observer : List.copyOf(observers)) {
            try {
                call.accept(observer);
            } catch (RuntimeException e) {
                log.warn("[Session] Observer threw, detaching. sessionId={}", sessionId, e);
                if (failed == null) {
                    failed = new ArrayList<>();
                }
                failed.add(observer);
            }
        }
        if (failed != null) {
            observers.removeAll(failed);
        }
    }
}
