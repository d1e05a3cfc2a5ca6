package com.agenthub.orchestrator.dispatch;

import com.agenthub.common.agent.AgentTypes;
import com.agenthub.common.exception.AgentConstructionException;
import com.agenthub.common.model.SelectionResult;
import com.agenthub.common.selector.AgentSelector;
import com.agenthub.orchestrator.cache.AgentCache;
import com.agenthub.orchestrator.cache.AgentCacheListener;
import com.agenthub.orchestrator.cache.CacheLookup;
import com.agenthub.orchestrator.cache.EvictionCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Routes one input to a live agent instance.
 *
 * <p>Flow per call:
 * <ol>
 *   <li>{@link AgentSelector} scores the input</li>
 *   <li>confidence below the threshold (hybrid fallback on) → the default type answers instead</li>
 *   <li>{@link AgentCache#get} serves or constructs the instance</li>
 *   <li>construction failure → one retry against the fallback type, when it differs</li>
 * </ol>
 *
 * <p>Cache lookups can construct an agent, so {@link #dispatch} runs them on
 * {@code Schedulers.boundedElastic()} and never on the caller's thread.
 */
public class AgentDispatcher implements AgentCacheListener {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatcher.class);

    private final AgentSelector selector;
    private final AgentCache cache;
    private final double confidenceThreshold;
    private final boolean hybridFallback;
    private final String fallbackAgentType;
    private final DispatchStats stats = new DispatchStats();

    public AgentDispatcher(AgentSelector selector, AgentCache cache, double confidenceThreshold,
                           boolean hybridFallback, String fallbackAgentType) {
        this.selector            = selector;
        this.cache               = cache;
        this.confidenceThreshold = confidenceThreshold;
        this.hybridFallback      = hybridFallback;
        this.fallbackAgentType   = fallbackAgentType == null || fallbackAgentType.isBlank()
            ? null : AgentTypes.normalize(fallbackAgentType);
        cache.addListener(this);
    }

    /**
     * Resolves the agent for {@code input}. Errors with {@link AgentConstructionException}
     * when neither the selected type nor the fallback type can be built.
     */
    public Mono<DispatchResult> dispatch(String input, String sessionId) {
        return Mono.fromCallable(() -> resolve(input, sessionId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /** Selection with the low-confidence override applied. Touches no cache entry. */
    public SelectionResult preview(String input) {
        return applyThreshold(selector.select(input));
    }

    public void recordResponseTime(Duration elapsed) {
        stats.recordResponseTime(elapsed);
    }

    public DispatchStatsSnapshot stats() {
        return stats.snapshot();
    }

    public List<String> availableAgentTypes() {
        return selector.agentTypes();
    }

    // ── cache events ──────────────────────────────────────────────────────────

    @Override
    public void onCreated(String agentType) {
        stats.created();
    }

    @Override
    public void onEvicted(String agentType, EvictionCause cause) {
        stats.evicted();
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private DispatchResult resolve(String input, String sessionId) {
        stats.dispatched();
        SelectionResult selection = applyThreshold(selector.select(input));
        if (selection.overridden()) {
            stats.lowConfidenceFallback();
        }
        log.info("[Dispatcher] Selected agentType={} confidence={} overriddenFrom={} sessionId={}",
                 selection.agentType(), String.format("%.2f", selection.confidence()),
                 selection.overriddenFrom(), sessionId);

        CacheLookup lookup;
        try {
            lookup = lookup(selection.agentType());
        } catch (AgentConstructionException primary) {
            String failed = selection.agentType();
            if (fallbackAgentType == null || fallbackAgentType.equals(failed)) {
                log.error("[Dispatcher] Construction failed, no fallback available. agentType={} sessionId={}",
                          failed, sessionId);
                throw primary;
            }

            log.warn("[Dispatcher] Construction failed for agentType={} — retrying with fallbackAgentType={} sessionId={}",
                     failed, fallbackAgentType, sessionId);
            stats.constructionFallback();
            selection = selection.withOverride(fallbackAgentType,
                "Fallback after construction failure of " + failed);
            try {
                lookup = lookup(fallbackAgentType);
            } catch (AgentConstructionException secondary) {
                secondary.addSuppressed(primary);
                log.error("[Dispatcher] Fallback construction failed. agentType={} sessionId={}",
                          fallbackAgentType, sessionId);
                throw secondary;
            }
        }

        return new DispatchResult(lookup.agent(), lookup.agentType(), selection, lookup.created());
    }

    private CacheLookup lookup(String agentType) {
        try {
            CacheLookup lookup = cache.get(agentType);
            if (lookup.created()) {
                stats.miss();
            } else {
                stats.hit();
            }
            return lookup;
        } catch (AgentConstructionException e) {
            stats.miss();
            stats.constructionFailure();
            throw e;
        }
    }

    private SelectionResult applyThreshold(SelectionResult selection) {
        if (!hybridFallback || selection.confidence() >= confidenceThreshold) {
            return selection;
        }
        String defaultType = selector.defaultAgentType();
        if (defaultType.equals(selection.agentType())) {
            return selection;
        }
        return selection.withOverride(defaultType, String.format(
            "Low confidence %.2f below threshold %.2f - using default", selection.confidence(), confidenceThreshold));
    }
}
