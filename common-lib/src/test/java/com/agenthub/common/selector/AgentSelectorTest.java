package com.agenthub.common.selector;

import com.agenthub.common.model.SelectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link AgentSelector} scoring, normalisation and tie-breaks.
 */
class AgentSelectorTest {

    private static final Map<String, List<String>> TRIGGERS = Map.of(
        "creative",  List.of("creative", "poem", "story"),
        "technical", List.of("code", "debug")
    );

    private final AgentSelector selector =
        new AgentSelector(TRIGGERS, List.of("technical", "creative"), "analytical");

    // ── scoring ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("select() — scoring")
    class ScoringTests {

        @Test
        @DisplayName("creative poem request → creative with full confidence")
        void creativePoem() {
            SelectionResult result = selector.select("please write a creative poem");

            assertEquals("creative", result.agentType());
            assertEquals(1.0, result.confidence(), 1e-9);
            assertEquals(3.0, result.scores().get("creative"), 1e-9);
            assertEquals(0.0, result.scores().get("technical"), 1e-9);
        }

        @Test
        @DisplayName("substring inside a longer word scores 1.0 without the word bonus")
        void substringWithoutWordBoundary() {
            SelectionResult result = selector.select("the decoder failed");

            assertEquals("technical", result.agentType());
            assertEquals(1.0, result.scores().get("technical"), 1e-9);
        }

        @Test
        @DisplayName("matching is case-insensitive")
        void caseInsensitive() {
            SelectionResult result = selector.select("DEBUG this CODE");

            assertEquals("technical", result.agentType());
            assertEquals(3.0, result.scores().get("technical"), 1e-9);
        }

        @Test
        @DisplayName("mixed input → confidence is the top share of all non-zero scores")
        void mixedInputConfidence() {
            // technical: code 1.5 + debug 1.5 = 3.0, creative: story 1.5
            SelectionResult result = selector.select("debug the code for my story app");

            assertEquals("technical", result.agentType());
            assertEquals(3.0 / 4.5, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("reasons name the matched terms")
        void reasonsListMatchedTerms() {
            SelectionResult result = selector.select("a story");

            assertEquals(1, result.reasons().size());
            assertTrue(result.reasons().get(0).contains("story"));
            assertFalse(result.overridden());
        }
    }

    // ── defaults and edge cases ─────────────────────────────────────────────

    @Nested
    @DisplayName("select() — defaults")
    class DefaultTests {

        @Test
        @DisplayName("empty input → default type, confidence 0")
        void emptyInput() {
            SelectionResult result = selector.select("");

            assertEquals("analytical", result.agentType());
            assertEquals(0.0, result.confidence());
        }

        @Test
        @DisplayName("null input → default type, confidence 0")
        void nullInput() {
            SelectionResult result = selector.select(null);

            assertEquals("analytical", result.agentType());
            assertEquals(0.0, result.confidence());
        }

        @Test
        @DisplayName("no trigger term present → default type, confidence 0")
        void noMatch() {
            SelectionResult result = selector.select("what is the weather like");

            assertEquals("analytical", result.agentType());
            assertEquals(0.0, result.confidence());
            assertEquals(Map.of("technical", 0.0, "creative", 0.0), result.scores());
        }

        @Test
        @DisplayName("type names in configuration are normalised")
        void normalisedConfiguration() {
            AgentSelector s = new AgentSelector(Map.of("TechnicalAgent", List.of(" Code ")),
                List.of(), "Analytical");

            assertEquals("analytical", s.defaultAgentType());
            assertEquals("technical", s.select("code").agentType());
        }
    }

    // ── determinism ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("select() — tie-breaks and determinism")
    class DeterminismTests {

        @Test
        @DisplayName("equal top scores resolve to the earlier type in priority order")
        void tieBreakByPriority() {
            // "code" and "poem" both score 1.5
            SelectionResult result = selector.select("code poem");

            assertEquals("technical", result.agentType());
            assertEquals(0.5, result.confidence(), 1e-9);

            AgentSelector reversed = new AgentSelector(TRIGGERS, List.of("creative", "technical"), "analytical");
            assertEquals("creative", reversed.select("code poem").agentType());
        }

        @Test
        @DisplayName("types missing from the priority list rank after listed ones, alphabetically")
        void unlistedTypesAreAlphabetical() {
            Map<String, List<String>> triggers = new LinkedHashMap<>();
            triggers.put("zeta", List.of("shared"));
            triggers.put("alpha", List.of("shared"));
            triggers.put("crm", List.of("shared"));

            AgentSelector s = new AgentSelector(triggers, List.of("crm"), "analytical");

            assertEquals(List.of("crm", "alpha", "zeta"), s.agentTypes());
            assertEquals("crm", s.select("shared").agentType());

            AgentSelector unlisted = new AgentSelector(new TreeMap<>(triggers), List.of(), "analytical");
            assertEquals("alpha", unlisted.select("shared").agentType());
        }

        @Test
        @DisplayName("repeated calls with identical input return identical results")
        void repeatable() {
            String input = "debug the poem code story";
            assertEquals(selector.select(input), selector.select(input));
        }
    }

    @Test
    @DisplayName("withOverride keeps the original pick and appends the reason")
    void overrideKeepsOriginalPick() {
        SelectionResult original = selector.select("a story");
        SelectionResult first = original.withOverride("analytical", "low confidence");
        SelectionResult second = first.withOverride("technical", "construction failed");

        assertEquals("technical", second.agentType());
        assertEquals("creative", second.overriddenFrom());
        assertTrue(second.overridden());
        assertEquals(original.reasons().size() + 2, second.reasons().size());
    }
}
