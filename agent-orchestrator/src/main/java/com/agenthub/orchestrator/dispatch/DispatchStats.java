package com.agenthub.orchestrator.dispatch;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters behind {@link AgentDispatcher#stats()}.
 *
 * <p>Counters are lock-free. The response-time window keeps the most recent
 * {@value #WINDOW_SIZE} samples and is guarded by its own monitor.
 */
public class DispatchStats {

    static final int WINDOW_SIZE = 100;

    private final AtomicLong totalDispatches        = new AtomicLong();
    private final AtomicLong created                = new AtomicLong();
    private final AtomicLong evicted                = new AtomicLong();
    private final AtomicLong hits                   = new AtomicLong();
    private final AtomicLong misses                 = new AtomicLong();
    private final AtomicLong lowConfidenceFallbacks = new AtomicLong();
    private final AtomicLong constructionFallbacks  = new AtomicLong();
    private final AtomicLong constructionFailures   = new AtomicLong();

    private final Deque<Long> responseTimesMs = new ArrayDeque<>(WINDOW_SIZE);
    private long windowTotalMs;

    void dispatched()            { totalDispatches.incrementAndGet(); }
    void created()               { created.incrementAndGet(); }
    void evicted()               { evicted.incrementAndGet(); }
    void hit()                   { hits.incrementAndGet(); }
    void miss()                  { misses.incrementAndGet(); }
    void lowConfidenceFallback() { lowConfidenceFallbacks.incrementAndGet(); }
    void constructionFallback()  { constructionFallbacks.incrementAndGet(); }
    void constructionFailure()   { constructionFailures.incrementAndGet(); }

    synchronized void recordResponseTime(Duration elapsed) {
        long ms = Math.max(0L, elapsed.toMillis());
        if (responseTimesMs.size() == WINDOW_SIZE) {
            windowTotalMs -= responseTimesMs.removeFirst();
        }
        responseTimesMs.addLast(ms);
        windowTotalMs += ms;
    }

    DispatchStatsSnapshot snapshot() {
        long h = hits.get();
        long m = misses.get();
        double hitRate = (h + m) == 0 ? 0.0 : (h * 100.0) / (h + m);

        double avg;
        int samples;
        synchronized (this) {
            samples = responseTimesMs.size();
            avg = samples == 0 ? 0.0 : (double) windowTotalMs / samples;
        }

        return new DispatchStatsSnapshot(
            totalDispatches.get(), created.get(), evicted.get(), h, m, hitRate,
            lowConfidenceFallbacks.get(), constructionFallbacks.get(), constructionFailures.get(),
            avg, samples);
    }
}
