package com.agenthub.orchestrator.cache;

import com.agenthub.common.agent.Agent;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns exactly one live agent instance. Hits update the usage fields under the entry's own
 * monitor only, never the cache's structure lock; eviction scans read them under that lock.
 *
 * <p>An entry is retired once, just before it is removed from the cache. A retired entry
 * refuses further touches, so a hit can never hand out an instance that an idle sweep is
 * about to release.
 */
final class CacheEntry {

    private final String agentType;
    private final Agent instance;
    private final Instant createdAt;
    private final AtomicLong useCount = new AtomicLong(1);
    private volatile Instant lastUsedAt;
    private volatile long accessOrder;
    private boolean retired;

    CacheEntry(String agentType, Agent instance, Instant createdAt, long accessOrder) {
        this.agentType   = agentType;
        this.instance    = instance;
        this.createdAt   = createdAt;
        this.lastUsedAt  = createdAt;
        this.accessOrder = accessOrder;
    }

    /** Records a use. Returns {@code false} when the entry has already been retired. */
    synchronized boolean touch(Instant now, long order) {
        if (retired) {
            return false;
        }
        lastUsedAt  = now;
        accessOrder = order;
        useCount.incrementAndGet();
        return true;
    }

    /** Retires the entry only if nothing touched it within {@code idleTimeout} of {@code now}. */
    synchronized boolean retireIfIdle(Instant now, Duration idleTimeout) {
        if (!retired && isIdle(now, idleTimeout)) {
            retired = true;
        }
        return retired;
    }

    synchronized void retire() {
        retired = true;
    }

    boolean isIdle(Instant now, Duration idleTimeout) {
        return now.toEpochMilli() - lastUsedAt.toEpochMilli() > idleTimeout.toMillis();
    }

    /** Older {@code lastUsedAt} first; the access counter orders touches within one clock tick. */
    boolean usedBefore(CacheEntry other) {
        int byTime = lastUsedAt.compareTo(other.lastUsedAt);
        return byTime != 0 ? byTime < 0 : accessOrder < other.accessOrder;
    }

    CacheEntrySnapshot snapshot() {
        return new CacheEntrySnapshot(agentType, useCount.get(), createdAt, lastUsedAt);
    }

    String agentType()  { return agentType; }
    Agent instance()    { return instance; }
    long useCount()     { return useCount.get(); }
    Instant lastUsedAt() { return lastUsedAt; }
}
