package com.agenthub.orchestrator.scheduler;

import com.agenthub.orchestrator.cache.AgentCache;
import com.agenthub.orchestrator.config.AgentHubProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Background timer that evicts idle agents. Runs on Reactor's parallel scheduler, never on the
 * request path.
 *
 * <p>The loop never stops on its own: a failing sweep is logged and the next tick runs as usual.
 */
@Component
public class AgentCacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(AgentCacheSweeper.class);

    private final AgentCache agentCache;
    private final Clock clock;
    private final Duration sweepInterval;

    private Disposable ticker;

    public AgentCacheSweeper(AgentCache agentCache, Clock clock, AgentHubProperties properties) {
        this.agentCache    = agentCache;
        this.clock         = clock;
        this.sweepInterval = properties.getCache().getSweepInterval();
    }

    @PostConstruct
    public void start() {
        log.info("[CacheSweeper] Started. sweepIntervalSeconds={}", sweepInterval.toSeconds());
        ticker = Flux.interval(sweepInterval, sweepInterval)
            .subscribe(tick -> sweep(), err -> log.error("[CacheSweeper] Timer terminated", err));
    }

    @PreDestroy
    public void stop() {
        if (ticker != null) {
            ticker.dispose();
        }
        log.info("[CacheSweeper] Stopped");
    }

    /** One pass; returns the evicted agent types. */
    public List<String> sweep() {
        try {
            List<String> evicted = agentCache.sweepIdle(clock.instant());
            if (!evicted.isEmpty()) {
                log.info("[CacheSweeper] Idle sweep evicted={} remaining={}", evicted, agentCache.size());
            }
            return evicted;
        } catch (RuntimeException e) {
            log.error("[CacheSweeper] Idle sweep failed — retrying next interval", e);
            return List.of();
        }
    }
}
