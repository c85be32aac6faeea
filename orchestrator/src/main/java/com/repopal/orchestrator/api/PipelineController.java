package com.repopal.orchestrator.api;

import com.repopal.orchestrator.api.dto.PipelineResponse;
import com.repopal.orchestrator.api.dto.TaskResponse;
import com.repopal.orchestrator.event.StandardizedEvent;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.PipelineState;
import com.repopal.orchestrator.queue.TaskQueue;
import com.repopal.orchestrator.service.PipelineOrchestrator;
import com.repopal.orchestrator.service.PipelineStateManager;
import com.repopal.orchestrator.store.PipelineNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for pipeline lifecycle.
 *
 * POST /pipelines               : ingress of a standardized event
 * GET  /pipelines/{id}          : current state, version, error and metadata
 * GET  /pipelines/{id}/tasks    : the stage tasks of a pipeline
 * POST /pipelines/{id}/cancel   : request cancellation
 * GET  /pipelines/metrics       : pipeline counts per state
 */
@RestController
@RequestMapping("/pipelines")
public class PipelineController {

    private final PipelineOrchestrator orchestrator;
    private final PipelineStateManager states;
    private final TaskQueue            queue;

    public PipelineController(PipelineOrchestrator orchestrator,
                              PipelineStateManager states,
                              TaskQueue queue) {
        this.orchestrator = orchestrator;
        this.states       = states;
        this.queue        = queue;
    }

    /**
     * Accept an event produced by a service adapter.
     *
     * Example:
     *   curl -X POST http://localhost:8080/pipelines \
     *     -H "Content-Type: application/json" \
     *     -d '{"service":"github","requestText":"format the code",
     *          "repository":{"name":"octo/demo","defaultBranch":"main","canRead":true,"canWrite":true}}'
     */
    @PostMapping
    public ResponseEntity<PipelineResponse> create(@RequestBody StandardizedEvent event) {
        UUID id;
        try {
            id = orchestrator.createPipeline(event);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(PipelineResponse.from(states.get(id)));
    }

    /** Returns 404 if the pipeline ID is not found. */
    @GetMapping("/{id}")
    public PipelineResponse get(@PathVariable UUID id) {
        return PipelineResponse.from(find(id));
    }

    @GetMapping("/{id}/tasks")
    public List<TaskResponse> tasks(@PathVariable UUID id) {
        find(id);
        return queue.tasksFor(id).stream()
                .map(TaskResponse::from)
                .toList();
    }

    /**
     * Flag the pipeline for cancellation. The pipeline fails with "cancelled" once
     * a worker notices, so this returns 202 with the state as of now.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<PipelineResponse> cancel(@PathVariable UUID id) {
        try {
            return ResponseEntity.accepted().body(PipelineResponse.from(orchestrator.cancel(id)));
        } catch (PipelineNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Pipeline not found: " + id);
        }
    }

    @GetMapping("/metrics")
    public Map<PipelineState, Long> metrics() {
        return states.countByState();
    }

    private Pipeline find(UUID id) {
        return states.find(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Pipeline not found: " + id));
    }
}
