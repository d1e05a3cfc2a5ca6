package com.agenthub.orchestrator.service;

import com.agenthub.common.exception.AgentConstructionException;
import com.agenthub.common.exception.SessionBusyException;
import com.agenthub.common.model.AgentResponse;
import com.agenthub.common.model.ErrorKind;
import com.agenthub.common.selector.AgentSelector;
import com.agenthub.orchestrator.cache.AgentCache;
import com.agenthub.orchestrator.dispatch.AgentDispatcher;
import com.agenthub.orchestrator.logger.TurnFlowLogger;
import com.agenthub.orchestrator.session.SessionObserver;
import com.agenthub.orchestrator.session.SessionRegistry;
import com.agenthub.orchestrator.support.Await;
import com.agenthub.orchestrator.support.MutableClock;
import com.agenthub.orchestrator.support.RecordingAgentFactory;
import com.agenthub.orchestrator.support.ScriptedAgent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RequestCoordinatorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private static final Map<String, List<String>> TRIGGERS = Map.of(
        "analytical", List.of("analyze", "data"),
        "creative",   List.of("write", "poem"),
        "technical",  List.of("code", "debug")
    );

    private RecordingAgentFactory factory;
    private SessionRegistry registry;
    private AgentDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        factory = new RecordingAgentFactory();
    }

    private RequestCoordinator build(Duration turnTimeout) {
        MutableClock clock = MutableClock.atEpoch();
        AgentCache cache = new AgentCache(factory, 3, Duration.ofMinutes(30), clock);
        AgentSelector selector = new AgentSelector(TRIGGERS, List.of("analytical", "technical", "creative"), "analytical");
        registry   = new SessionRegistry(clock);
        dispatcher = new AgentDispatcher(selector, cache, 0.3, true, "analytical");
        return new RequestCoordinator(registry, dispatcher, turnTimeout, new TurnFlowLogger(), clock);
    }

    /** Waits until the dispatched agent of {@code type} holds an open call for {@code sessionId}. */
    private ScriptedAgent awaitCall(String type, String sessionId) {
        Await.until(() -> factory.lastBuilt(type) != null && factory.lastBuilt(type).hasPendingCall(sessionId));
        return factory.lastBuilt(type);
    }

    // ── submission ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("submit()")
    class SubmitTests {

        @Test
        @DisplayName("successful turn: fragments buffered, response delivered, session idle")
        void successfulTurn() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            SubmissionReceipt receipt = coordinator.submit("s-1", "please write a poem");
            ScriptedAgent agent = awaitCall("creative", "s-1");
            agent.emit("s-1", "Roses ");
            agent.emit("s-1", "are red");
            agent.finish("s-1", "Roses are red");

            AgentResponse response = receipt.response().block(WAIT);

            assertNotNull(response);
            assertTrue(response.success());
            assertEquals("Roses are red", response.content());
            assertEquals(List.of("Roses ", "are red"), registry.bufferedOutput("s-1"));
            assertFalse(registry.isInFlight("s-1"));
            assertTrue(registry.hasUnseenOutput("s-1"));
            assertEquals("creative", registry.status("s-1").orElseThrow().lastAgentType());
            assertEquals(1, dispatcher.stats().responseSamples());
        }

        @Test
        @DisplayName("second submit while in flight → SessionBusyException, first turn unaffected")
        void busyRejection() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            SubmissionReceipt first = coordinator.submit("s-1", "analyze data");
            ScriptedAgent agent = awaitCall("analytical", "s-1");

            SessionBusyException ex = assertThrows(SessionBusyException.class,
                () -> coordinator.submit("s-1", "debug code"));
            assertEquals("s-1", ex.getSessionId());

            agent.finish("s-1", "done");
            assertEquals("done", first.response().block(WAIT).content());
            assertEquals(1, agent.callCount());
            assertEquals(0, factory.constructions("technical"));
        }

        @Test
        @DisplayName("blank input is rejected before the session is touched")
        void blankInput() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            assertThrows(IllegalArgumentException.class, () -> coordinator.submit("s-1", "  "));
            assertThrows(IllegalArgumentException.class, () -> coordinator.submit(" ", "hello"));
            assertTrue(registry.status("s-1").isEmpty());
        }

        @Test
        @DisplayName("the same session accepts a new message once the previous turn finished")
        void sequentialTurns() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            SubmissionReceipt first = coordinator.submit("s-1", "analyze data");
            awaitCall("analytical", "s-1").finish("s-1", "one");
            first.response().block(WAIT);

            SubmissionReceipt second = coordinator.submit("s-1", "analyze more data");
            awaitCall("analytical", "s-1").finish("s-1", "two");

            assertEquals("two", second.response().block(WAIT).content());
            assertNotEquals(first.turnId(), second.turnId());
            assertEquals(2, registry.status("s-1").orElseThrow().completedTurns());
        }
    }

    // ── isolation ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("session isolation")
    class IsolationTests {

        @Test
        @DisplayName("two sessions run concurrently on one shared agent instance")
        void concurrentSessions() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            SubmissionReceipt a = coordinator.submit("s-a", "analyze data");
            SubmissionReceipt b = coordinator.submit("s-b", "analyze numbers data");
            ScriptedAgent agent = awaitCall("analytical", "s-a");
            awaitCall("analytical", "s-b");

            agent.emit("s-a", "A1");
            agent.emit("s-b", "B1");
            agent.finish("s-b", "B");
            agent.finish("s-a", "A");

            assertEquals("A", a.response().block(WAIT).content());
            assertEquals("B", b.response().block(WAIT).content());
            assertEquals(List.of("A1"), registry.bufferedOutput("s-a"));
            assertEquals(List.of("B1"), registry.bufferedOutput("s-b"));
            assertEquals(1, factory.constructions("analytical"));
        }

        @Test
        @DisplayName("a failing turn is attributed to its own session only")
        void failureIsolation() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            SubmissionReceipt a = coordinator.submit("s-a", "analyze data");
            SubmissionReceipt b = coordinator.submit("s-b", "analyze data");
            ScriptedAgent agent = awaitCall("analytical", "s-a");
            awaitCall("analytical", "s-b");

            agent.fail("s-a", new IllegalStateException("provider down"));
            agent.finish("s-b", "fine");

            AgentResponse failed = a.response().block(WAIT);
            assertFalse(failed.success());
            assertEquals(ErrorKind.PROCESSING, failed.errorKind());
            assertTrue(failed.content().contains("provider down"));
            assertTrue(b.response().block(WAIT).success());
            assertFalse(registry.isInFlight("s-a"));
            assertEquals(1, registry.status("s-a").orElseThrow().failedTurns());
            assertEquals(0, registry.status("s-b").orElseThrow().failedTurns());
        }
    }

    // ── failures ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("failed turns")
    class FailureTests {

        @Test
        @DisplayName("no response within the turn timeout → TIMEOUT, session idle, late fragments dropped")
        void timeout() {
            RequestCoordinator coordinator = build(Duration.ofMillis(200));

            SubmissionReceipt receipt = coordinator.submit("s-1", "analyze data");
            ScriptedAgent agent = awaitCall("analytical", "s-1");

            AgentResponse response = receipt.response().block(WAIT);

            assertFalse(response.success());
            assertEquals(ErrorKind.TIMEOUT, response.errorKind());
            assertFalse(registry.isInFlight("s-1"));

            agent.emit("s-1", "too late");
            assertTrue(registry.bufferedOutput("s-1").isEmpty());
        }

        @Test
        @DisplayName("construction failure of both selected and fallback type → CONSTRUCTION")
        void constructionFailure() {
            factory.breakType("creative").breakType("analytical");
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            AgentResponse response = coordinator.submit("s-1", "write a poem").response().block(WAIT);

            assertFalse(response.success());
            assertEquals(ErrorKind.CONSTRUCTION, response.errorKind());
            assertNull(response.agentType());
            assertFalse(registry.isInFlight("s-1"));
        }

        @Test
        @DisplayName("error kinds map from exception types")
        void errorKinds() {
            assertEquals(ErrorKind.CONSTRUCTION,
                RequestCoordinator.errorKind(new AgentConstructionException("crm", "x")));
            assertEquals(ErrorKind.PROCESSING,
                RequestCoordinator.errorKind(new IllegalStateException("x")));
        }
    }

    // ── observers ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("observers")
    class ObserverTests {

        @Test
        @DisplayName("attach after 3 of 5 fragments sees all 5 in order, then the response")
        void lateAttach() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            SubmissionReceipt receipt = coordinator.submit("s-1", "analyze data");
            ScriptedAgent agent = awaitCall("analytical", "s-1");
            agent.emit("s-1", "1");
            agent.emit("s-1", "2");
            agent.emit("s-1", "3");

            List<String> seen = new CopyOnWriteArrayList<>();
            List<AgentResponse> completed = new CopyOnWriteArrayList<>();
            registry.attach("s-1", new SessionObserver() {
                @Override public void onFragment(String fragment) { seen.add(fragment); }
                @Override public void onTurnComplete(AgentResponse response) { completed.add(response); }
            });

            agent.emit("s-1", "4");
            agent.emit("s-1", "5");
            agent.finish("s-1", "12345");
            receipt.response().block(WAIT);

            assertEquals(List.of("1", "2", "3", "4", "5"), seen);
            assertEquals(1, completed.size());
            assertFalse(registry.hasUnseenOutput("s-1"));
        }

        @Test
        @DisplayName("detaching mid-turn does not cancel the agent call")
        void detachDoesNotCancel() {
            RequestCoordinator coordinator = build(Duration.ofSeconds(10));

            SubmissionReceipt receipt = coordinator.submit("s-1", "analyze data");
            ScriptedAgent agent = awaitCall("analytical", "s-1");
            registry.attach("s-1", fragment -> { }).detach();

            agent.emit("s-1", "still running");
            agent.finish("s-1", "still running");

            assertTrue(receipt.response().block(WAIT).success());
            assertTrue(registry.hasUnseenOutput("s-1"));
        }
    }
}
