package com.repopal.orchestrator.api;

import com.repopal.orchestrator.model.*;
import com.repopal.orchestrator.queue.TaskQueue;
import com.repopal.orchestrator.service.PipelineOrchestrator;
import com.repopal.orchestrator.service.PipelineStateManager;
import com.repopal.orchestrator.store.PipelineNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for PipelineController: web layer only, no database and no scheduler.
 */
@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean PipelineOrchestrator orchestrator;
    @MockitoBean PipelineStateManager states;
    @MockitoBean TaskQueue            queue;

    // ------------------------------------------------------------------
    // POST /pipelines
    // ------------------------------------------------------------------

    @Test
    void create_validEvent_returns201WithPipeline() throws Exception {
        Pipeline pipeline = fakePipeline(PipelineState.PROCESSING, 2);
        when(orchestrator.createPipeline(any())).thenReturn(pipeline.getId());
        when(states.get(pipeline.getId())).thenReturn(pipeline);

        mockMvc.perform(post("/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"service":"github","requestText":"format the code",
                                 "repository":{"name":"org/repo","defaultBranch":"main","canRead":true,"canWrite":true},
                                 "metadata":{"notify":["slack"]}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(pipeline.getId().toString()))
                .andExpect(jsonPath("$.state").value("PROCESSING"))
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.repository").value("org/repo"));
    }

    @Test
    void create_rejectedEvent_returns400() throws Exception {
        when(orchestrator.createPipeline(any()))
                .thenThrow(new IllegalArgumentException("Event has no repository"));

        mockMvc.perform(post("/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"service":"github","requestText":"format the code"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /pipelines/{id}
    // ------------------------------------------------------------------

    @Test
    void get_existingId_returnsStateVersionAndError() throws Exception {
        Pipeline pipeline = fakePipeline(PipelineState.FAILED, 5);
        pipeline.setError("Command exited with code 2");
        pipeline.mergeMetadata(Map.of("failedStage", "EXECUTE"));
        when(states.find(pipeline.getId())).thenReturn(Optional.of(pipeline));

        mockMvc.perform(get("/pipelines/{id}", pipeline.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.version").value(5))
                .andExpect(jsonPath("$.error").value("Command exited with code 2"))
                .andExpect(jsonPath("$.metadata.failedStage").value("EXECUTE"));
    }

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(states.find(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/pipelines/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /pipelines/{id}/tasks
    // ------------------------------------------------------------------

    @Test
    void tasks_returnsStageTasks() throws Exception {
        Pipeline pipeline = fakePipeline(PipelineState.DISPATCHING, 3);
        StageTask task = new StageTask(UUID.randomUUID(), pipeline.getId(), Stage.DISPATCH, 3, "{}",
                pipeline.getId() + ":DISPATCH:3", 0, Instant.now());
        when(states.find(pipeline.getId())).thenReturn(Optional.of(pipeline));
        when(queue.tasksFor(pipeline.getId())).thenReturn(List.of(task));

        mockMvc.perform(get("/pipelines/{id}/tasks", pipeline.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stage").value("DISPATCH"))
                .andExpect(jsonPath("$[0].lane").value("CONTROL"))
                .andExpect(jsonPath("$[0].expectedVersion").value(3));
    }

    @Test
    void tasks_unknownPipeline_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(states.find(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/pipelines/{id}/tasks", unknown))
                .andExpect(status().isNotFound());
        verify(queue, never()).tasksFor(unknown);
    }

    // ------------------------------------------------------------------
    // POST /pipelines/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_existingPipeline_returns202() throws Exception {
        Pipeline pipeline = fakePipeline(PipelineState.EXECUTING, 5);
        pipeline.setCancelRequested(true);
        when(orchestrator.cancel(pipeline.getId())).thenReturn(pipeline);

        mockMvc.perform(post("/pipelines/{id}/cancel", pipeline.getId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelRequested").value(true))
                .andExpect(jsonPath("$.state").value("EXECUTING"));
    }

    @Test
    void cancel_unknownPipeline_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(orchestrator.cancel(unknown)).thenThrow(new PipelineNotFoundException(unknown));

        mockMvc.perform(post("/pipelines/{id}/cancel", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /pipelines/metrics
    // ------------------------------------------------------------------

    @Test
    void metrics_returnsCountPerState() throws Exception {
        Map<PipelineState, Long> counts = new EnumMap<>(PipelineState.class);
        for (PipelineState s : PipelineState.values()) counts.put(s, 0L);
        counts.put(PipelineState.COMPLETED, 7L);
        counts.put(PipelineState.FAILED, 2L);
        when(states.countByState()).thenReturn(counts);

        mockMvc.perform(get("/pipelines/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.COMPLETED").value(7))
                .andExpect(jsonPath("$.FAILED").value(2))
                .andExpect(jsonPath("$.RECEIVED").value(0));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Pipeline fakePipeline(PipelineState state, long version) {
        Pipeline p = new Pipeline(UUID.randomUUID(), "github", "org/repo");
        p.setState(state);
        p.setVersion(version);
        return p;
    }
}
