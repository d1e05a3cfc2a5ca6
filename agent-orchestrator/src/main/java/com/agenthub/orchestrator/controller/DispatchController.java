package com.agenthub.orchestrator.controller;

import com.agenthub.common.model.SelectionResult;
import com.agenthub.orchestrator.cache.AgentCache;
import com.agenthub.orchestrator.dispatch.AgentDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/dispatch")
public class DispatchController {

    private final AgentDispatcher agentDispatcher;
    private final AgentCache agentCache;

    public DispatchController(AgentDispatcher agentDispatcher, AgentCache agentCache) {
        this.agentDispatcher = agentDispatcher;
        this.agentCache      = agentCache;
    }

    @GetMapping("/stats")
    public DispatchStatsResponse stats() {
        return new DispatchStatsResponse(agentDispatcher.stats(), agentCache.size(), agentCache.capacity(),
            agentCache.snapshot(), agentDispatcher.availableAgentTypes());
    }

    /** Which agent would answer, without constructing or touching one. */
    @PostMapping("/select")
    public SelectionResult select(@RequestBody MessageRequest request) {
        return agentDispatcher.preview(request == null ? null : request.input());
    }

    @DeleteMapping("/cache/{agentType}")
    public ResponseEntity<Void> evict(@PathVariable String agentType) {
        return agentCache.evict(agentType)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
