package com.agenthub.common.selector;

import com.agenthub.common.agent.AgentTypes;
import com.agenthub.common.model.SelectionResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword scorer that maps an input text to the agent type best suited to answer it.
 *
 * <p>Scoring rules, per agent type:
 * <ol>
 *   <li>each trigger term found as a case-insensitive substring → +1.0</li>
 *   <li>the same term also matching on word boundaries          → +0.5</li>
 * </ol>
 * {@code confidence = maxScore / sum(non-zero scores)}, clamped to [0, 1].
 * All-zero scores (or blank input) → the default type with confidence 0.0.
 *
 * <p>Equal top scores resolve by the configured priority order. Types missing from that
 * list rank after the listed ones, alphabetically, so the result never depends on map
 * iteration order.
 *
 * <p>Immutable after construction. No reactive types. No logging. No side-effects.
 */
public final class AgentSelector {

    private static final double SUBSTRING_SCORE  = 1.0;
    private static final double WHOLE_WORD_BONUS = 0.5;

    private final List<TypeTriggers> orderedTriggers;
    private final String defaultAgentType;

    /**
     * @param triggers         agent type → trigger terms
     * @param priorityOrder    tie-break order, highest priority first; may be empty
     * @param defaultAgentType returned when nothing matches
     */
    public AgentSelector(Map<String, List<String>> triggers, List<String> priorityOrder,
                         String defaultAgentType) {
        this.defaultAgentType = AgentTypes.normalize(defaultAgentType);

        List<String> priority = priorityOrder == null ? List.of()
            : priorityOrder.stream().map(AgentTypes::normalize).distinct().toList();

        Map<String, Set<String>> termsByType = new LinkedHashMap<>();
        if (triggers != null) {
            triggers.forEach((type, terms) -> {
                Set<String> bucket = termsByType.computeIfAbsent(AgentTypes.normalize(type),
                    k -> new LinkedHashSet<>());
                if (terms != null) {
                    terms.stream()
                        .filter(t -> t != null && !t.isBlank())
                        .map(t -> t.trim().toLowerCase(Locale.ROOT))
                        .forEach(bucket::add);
                }
            });
        }

        Comparator<String> byPriority = Comparator
            .comparingInt((String type) -> {
                int idx = priority.indexOf(type);
                return idx < 0 ? Integer.MAX_VALUE : idx;
            })
            .thenComparing(Comparator.naturalOrder());

        this.orderedTriggers = termsByType.keySet().stream()
            .sorted(byPriority)
            .map(type -> new TypeTriggers(type, termsByType.get(type).stream().map(Term::new).toList()))
            .toList();
    }

    /**
     * Scores {@code input} against every configured type.
     *
     * @param input raw user text; {@code null} is treated as empty
     * @return never {@code null}
     */
    public SelectionResult select(String input) {
        Map<String, Double> scores = new LinkedHashMap<>();
        List<String> reasons = new ArrayList<>();

        if (input == null || input.isBlank()) {
            orderedTriggers.forEach(t -> scores.put(t.type(), 0.0));
            return SelectionResult.of(defaultAgentType, 0.0, scores,
                List.of("Default selection - empty input"));
        }

        String lower = input.toLowerCase(Locale.ROOT);
        String bestType = null;
        double bestScore = 0.0;
        double total = 0.0;

        for (TypeTriggers triggers : orderedTriggers) {
            double score = 0.0;
            List<String> matched = new ArrayList<>();
            for (Term term : triggers.terms()) {
                if (lower.contains(term.text())) {
                    score += SUBSTRING_SCORE;
                    if (term.wholeWord().matcher(lower).find()) {
                        score += WHOLE_WORD_BONUS;
                    }
                    matched.add(term.text());
                }
            }
            scores.put(triggers.type(), score);
            if (score > 0.0) {
                total += score;
                reasons.add(String.format("%s matched %s (score %.1f)", triggers.type(), matched, score));
                // strict '>' keeps the earlier (higher-priority) type on ties
                if (score > bestScore) {
                    bestScore = score;
                    bestType = triggers.type();
                }
            }
        }

        if (bestType == null) {
            return SelectionResult.of(defaultAgentType, 0.0, scores,
                List.of("Default selection - no trigger terms found"));
        }

        double confidence = Math.max(0.0, Math.min(1.0, bestScore / total));
        return SelectionResult.of(bestType, confidence, scores, reasons);
    }

    public String defaultAgentType() {
        return defaultAgentType;
    }

    /** Configured types in tie-break order. */
    public List<String> agentTypes() {
        return orderedTriggers.stream().map(TypeTriggers::type).toList();
    }

    private record TypeTriggers(String type, List<Term> terms) {}

    private record Term(String text, Pattern wholeWord) {
        Term(String text) {
            this(text, Pattern.compile("\\b" + Pattern.quote(text) + "\\b"));
        }
    }
}
