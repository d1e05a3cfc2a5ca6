package com.agenthub.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one keyword selection.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code agentType}      — the type that should answer</li>
 *   <li>{@code confidence}     — top score share of all non-zero scores, in [0.0, 1.0]</li>
 *   <li>{@code scores}         — raw score per configured type, in priority order</li>
 *   <li>{@code reasons}        — matched terms, readable</li>
 *   <li>{@code overriddenFrom} — the selector's own pick when the dispatcher substituted
 *       another type, otherwise {@code null}</li>
 * </ul>
 *
 * <p>Created per dispatch call, never persisted.
 */
public record SelectionResult(
    String agentType,
    double confidence,
    Map<String, Double> scores,
    List<String> reasons,
    String overriddenFrom
) {
    public SelectionResult {
        scores  = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        reasons = List.copyOf(reasons);
    }

    public static SelectionResult of(String agentType, double confidence,
                                     Map<String, Double> scores, List<String> reasons) {
        return new SelectionResult(agentType, confidence, scores, reasons, null);
    }

    /**
     * Returns a copy pointing at {@code replacement}. The first override wins for
     * {@code overriddenFrom}, so a chain of substitutions still names the original pick.
     */
    public SelectionResult withOverride(String replacement, String reason) {
        List<String> extended = new ArrayList<>(reasons);
        extended.add(reason);
        String original = overriddenFrom != null ? overriddenFrom : agentType;
        return new SelectionResult(replacement, confidence, scores, extended, original);
    }

    public boolean overridden() {
        return overriddenFrom != null;
    }
}
