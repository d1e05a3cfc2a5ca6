package com.agenthub.orchestrator.cache;

import com.agenthub.common.agent.Agent;
import com.agenthub.common.agent.AgentFactory;
import com.agenthub.common.agent.AgentTypes;
import com.agenthub.common.exception.AgentConstructionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of live agent instances, at most one per agent type.
 *
 * <p><strong>Construct once → serve many:</strong> a miss builds the instance through the
 * injected {@link AgentFactory}; every later request for that type reuses it until it is
 * evicted. Eviction happens on capacity pressure (least recently used first), on an idle
 * sweep, on explicit request, or at shutdown, and always calls {@link Agent#release()}.
 *
 * <h3>Locking</h3>
 * <ul>
 *   <li>Hits take no cache-wide lock, only the entry's own monitor for the usage update.</li>
 *   <li>Misses are serialised per agent type, so concurrent misses on one type construct a
 *       single instance while misses on different types construct in parallel.</li>
 *   <li>Map mutations that must stay consistent with the capacity bound (evict-then-insert,
 *       sweeps, manual removal) run under one short structure lock that is never held while
 *       constructing or releasing an agent.</li>
 * </ul>
 *
 * <p>Every removal retires the entry inside the same structure-lock section, so a hit racing a
 * removal either wins (and the entry stays) or falls through to the miss path.
 *
 * <p>A failed construction changes nothing: no entry is inserted and nothing is evicted.
 */
public class AgentCache {

    private static final Logger log = LoggerFactory.getLogger(AgentCache.class);

    private final AgentFactory factory;
    private final int capacity;
    private final Duration idleTimeout;
    private final Clock clock;

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Object> constructionLocks = new ConcurrentHashMap<>();
    private final Object structureLock = new Object();
    private final AtomicLong accessSequence = new AtomicLong();
    private final List<AgentCacheListener> listeners = new CopyOnWriteArrayList<>();

    public AgentCache(AgentFactory factory, int capacity, Duration idleTimeout, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
        }
        this.factory     = factory;
        this.capacity    = capacity;
        this.idleTimeout = idleTimeout;
        this.clock       = clock;
        log.info("[AgentCache] Initialized. capacity={} idleTimeoutSeconds={}", capacity, idleTimeout.toSeconds());
    }

    public void addListener(AgentCacheListener listener) {
        listeners.add(listener);
    }

    /**
     * Returns the cached instance for {@code agentType}, constructing it on a miss.
     *
     * @throws AgentConstructionException when the factory fails; the cache is unchanged
     */
    public CacheLookup get(String agentType) {
        String type = AgentTypes.normalize(agentType);

        CacheEntry hit = touchIfPresent(type);
        if (hit != null) {
            return new CacheLookup(type, hit.instance(), false);
        }

        Object lock = constructionLocks.computeIfAbsent(type, k -> new Object());
        synchronized (lock) {
            // another caller may have finished constructing while we waited
            hit = touchIfPresent(type);
            if (hit != null) {
                return new CacheLookup(type, hit.instance(), false);
            }

            log.info("[AgentCache] Cache MISS agentType={} — constructing", type);
            Agent agent = construct(type);

            CacheEntry entry = new CacheEntry(type, agent, clock.instant(), accessSequence.incrementAndGet());
            CacheEntry evicted = null;
            synchronized (structureLock) {
                if (entries.size() >= capacity) {
                    evicted = leastRecentlyUsed();
                    evicted.retire();
                    entries.remove(evicted.agentType());
                }
                entries.put(type, entry);
            }

            if (evicted != null) {
                log.info("[AgentCache] Evicted LRU agentType={} useCount={} to make room for agentType={}",
                         evicted.agentType(), evicted.useCount(), type);
                release(evicted, EvictionCause.CAPACITY);
            }
            log.info("[AgentCache] Created and cached agentType={} size={}/{}", type, entries.size(), capacity);
            listeners.forEach(l -> l.onCreated(type));
            return new CacheLookup(type, agent, true);
        }
    }

    /**
     * Removes and releases every entry unused for longer than the idle timeout,
     * regardless of how full the cache is.
     *
     * @return the evicted agent types
     */
    public List<String> sweepIdle(Instant now) {
        List<CacheEntry> idle = new ArrayList<>();
        synchronized (structureLock) {
            for (CacheEntry entry : entries.values()) {
                if (entry.retireIfIdle(now, idleTimeout) && entries.remove(entry.agentType(), entry)) {
                    idle.add(entry);
                }
            }
        }
        for (CacheEntry entry : idle) {
            log.info("[AgentCache] Evicted idle agentType={} lastUsedAt={}", entry.agentType(), entry.lastUsedAt());
            release(entry, EvictionCause.IDLE);
        }
        return idle.stream().map(CacheEntry::agentType).toList();
    }

    /**
     * Administrative removal.
     *
     * @return {@code false} when the type was not cached
     */
    public boolean evict(String agentType) {
        String type = AgentTypes.normalize(agentType);
        CacheEntry removed;
        synchronized (structureLock) {
            removed = entries.remove(type);
            if (removed != null) {
                removed.retire();
            }
        }
        if (removed == null) {
            return false;
        }
        log.info("[AgentCache] Manually evicted agentType={}", type);
        release(removed, EvictionCause.MANUAL);
        return true;
    }

    /** Releases every cached instance. Used at shutdown. */
    public void clear() {
        List<CacheEntry> all;
        synchronized (structureLock) {
            all = new ArrayList<>(entries.values());
            all.forEach(CacheEntry::retire);
            entries.clear();
        }
        log.info("[AgentCache] Cleaning up {} cached agents", all.size());
        all.forEach(entry -> release(entry, EvictionCause.SHUTDOWN));
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean contains(String agentType) {
        return entries.containsKey(AgentTypes.normalize(agentType));
    }

    /** Entries ordered most recently used first. */
    public List<CacheEntrySnapshot> snapshot() {
        return entries.values().stream()
            .map(CacheEntry::snapshot)
            .sorted(Comparator.comparing(CacheEntrySnapshot::lastUsedAt).reversed())
            .toList();
    }

    // ── internals ─────────────────────────────────────────────────────────────

    /** Returns {@code null} on a miss, including an entry retired by a concurrent removal. */
    private CacheEntry touchIfPresent(String type) {
        CacheEntry entry = entries.get(type);
        if (entry == null) {
            return null;
        }
        if (!entry.touch(clock.instant(), accessSequence.incrementAndGet())) {
            log.debug("[AgentCache] Entry retired during lookup agentType={}", type);
            return null;
        }
        log.debug("[AgentCache] Cache HIT agentType={} useCount={}", type, entry.useCount());
        return entry;
    }

    private Agent construct(String type) {
        Agent agent;
        try {
            agent = factory.create(type);
        } catch (AgentConstructionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentConstructionException(type, "Construction failed: " + e.getMessage(), e);
        }
        if (agent == null) {
            throw new AgentConstructionException(type, "Factory returned no instance");
        }
        return agent;
    }

    /** Caller holds {@link #structureLock} and has checked the map is not empty. */
    private CacheEntry leastRecentlyUsed() {
        CacheEntry oldest = null;
        for (CacheEntry entry : entries.values()) {
            if (oldest == null || entry.usedBefore(oldest)) {
                oldest = entry;
            }
        }
        return oldest;
    }

    private void release(CacheEntry entry, EvictionCause cause) {
        try {
            entry.instance().release();
        } catch (RuntimeException e) {
            log.error("[AgentCache] Error releasing agentType={} cause={}", entry.agentType(), cause, e);
        }
        listeners.forEach(l -> l.onEvicted(entry.agentType(), cause));
    }
}
