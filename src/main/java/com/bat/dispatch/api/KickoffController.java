package com.bat.dispatch.api;

import com.bat.core.engine.KickoffEngine;
import com.bat.core.events.BatEvent;
import com.bat.core.events.EventBus;
import com.bat.core.model.TaskPlan;
import com.bat.core.model.TaskRequest;
import com.bat.core.orchestrator.AgentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for running task batches.
 */
@RestController
@RequestMapping("/api/v1/kickoff")
public class KickoffController {

    private static final Logger log = LoggerFactory.getLogger(KickoffController.class);

    private final KickoffEngine kickoffEngine;
    private final EventBus eventBus;

    public KickoffController(KickoffEngine kickoffEngine, EventBus eventBus) {
        this.kickoffEngine = kickoffEngine;
        this.eventBus = eventBus;
    }

    /**
     * POST /api/v1/kickoff: runs a plan and waits for every task to settle.
     * Task failures are part of the 200 response; only an invalid plan gives 400.
     */
    @PostMapping
    public ResponseEntity<Object> kickoff(@RequestBody TaskPlan plan) {
        if (plan.tasks().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one task is required"));
        }
        for (TaskRequest request : plan.tasks()) {
            if (request.description() == null || request.description().isBlank()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Task description is required"));
            }
        }

        String runId = kickoffEngine.generateRunId();
        log.info("Accepted run {} with {} tasks", runId, plan.tasks().size());
        try {
            return ResponseEntity.ok(kickoffEngine.run(runId, plan));
        } catch (AgentNotFoundException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/kickoff/{runId}/events: lifecycle events of a recent run, oldest first.
     */
    @GetMapping("/{runId}/events")
    public ResponseEntity<List<BatEvent>> events(@PathVariable String runId) {
        List<BatEvent> events = eventBus.history(runId);
        if (events.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(events);
    }
}
