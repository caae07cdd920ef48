package com.bat.dispatch.api;

import com.bat.core.engine.KickoffEngine;
import com.bat.core.events.BatEvent;
import com.bat.core.events.EventBus;
import com.bat.core.model.KickoffResult;
import com.bat.core.model.Priority;
import com.bat.core.model.TaskPlan;
import com.bat.core.model.TaskReport;
import com.bat.core.model.TaskRequest;
import com.bat.core.model.TaskStatus;
import com.bat.core.orchestrator.AgentNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(KickoffController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class KickoffControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private KickoffEngine kickoffEngine;

    @MockitoBean
    private EventBus eventBus;

    @Test
    @DisplayName("POST /kickoff returns positional results and task reports")
    void kickoff() throws Exception {
        when(kickoffEngine.generateRunId()).thenReturn("BAT-2026-0001");
        when(kickoffEngine.run(eq("BAT-2026-0001"), any(TaskPlan.class))).thenReturn(new KickoffResult(
                "BAT-2026-0001",
                List.of("Paris", "Task failed: boom"),
                List.of(new TaskReport("TASK-001", "Capital?", "Researcher", Priority.HIGH, TaskStatus.COMPLETED, 0, "Paris"),
                        new TaskReport("TASK-002", "Break", "Writer", Priority.LOW, TaskStatus.FAILED, 3, "Task failed: boom"))));

        String body = objectMapper.writeValueAsString(new TaskPlan(List.of(
                new TaskRequest("Capital?", "Researcher", "high", null, null),
                new TaskRequest("Break", "Writer", "low", null, null))));

        mockMvc.perform(post("/api/v1/kickoff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("BAT-2026-0001"))
                .andExpect(jsonPath("$.results[0]").value("Paris"))
                .andExpect(jsonPath("$.results[1]").value("Task failed: boom"))
                .andExpect(jsonPath("$.tasks[1].status").value("FAILED"))
                .andExpect(jsonPath("$.tasks[1].attempts").value(3));
    }

    @Test
    @DisplayName("POST /kickoff with an unknown role returns 400 with error")
    void unknownRole() throws Exception {
        when(kickoffEngine.generateRunId()).thenReturn("BAT-2026-0002");
        when(kickoffEngine.run(eq("BAT-2026-0002"), any(TaskPlan.class)))
                .thenThrow(new AgentNotFoundException("Ghost"));

        mockMvc.perform(post("/api/v1/kickoff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\": [{\"description\": \"haunt\", \"agentRole\": \"Ghost\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Agent with role Ghost not found"));
    }

    @Test
    @DisplayName("POST /kickoff with no tasks returns 400")
    void emptyPlan() throws Exception {
        mockMvc.perform(post("/api/v1/kickoff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one task is required"));

        verify(kickoffEngine, never()).run(any(), any());
    }

    @Test
    @DisplayName("POST /kickoff with a blank description returns 400")
    void blankDescription() throws Exception {
        mockMvc.perform(post("/api/v1/kickoff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\": [{\"description\": \" \", \"agentRole\": \"Writer\"}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /kickoff/{runId}/events returns the run's events in order")
    void events() throws Exception {
        when(eventBus.history("BAT-2026-0003")).thenReturn(List.of(
                BatEvent.of("run.started", "BAT-2026-0003", null, Map.of("taskCount", 1)),
                BatEvent.of("task.failed", "BAT-2026-0003", "TASK-001", Map.of("error", "boom"))));

        mockMvc.perform(get("/api/v1/kickoff/BAT-2026-0003/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].eventType").value("run.started"))
                .andExpect(jsonPath("$[1].taskId").value("TASK-001"))
                .andExpect(jsonPath("$[1].payload.error").value("boom"));
    }

    @Test
    @DisplayName("GET /kickoff/{runId}/events for an unknown run returns 404")
    void unknownRunEvents() throws Exception {
        when(eventBus.history("BAT-2026-9999")).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/kickoff/BAT-2026-9999/events"))
                .andExpect(status().isNotFound());
    }
}
