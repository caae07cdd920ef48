package com.bat.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setRun sets the runId key")
    void setRun() {
        MdcContext.setRun("BAT-2026-0001");
        assertEquals("BAT-2026-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setTask sets run, task and agent keys")
    void setTask() {
        MdcContext.setTask("BAT-2026-0001", "TASK-001", "Writer");
        assertEquals("BAT-2026-0001", MDC.get("runId"));
        assertEquals("TASK-001", MDC.get("taskId"));
        assertEquals("Writer", MDC.get("agentRole"));
    }

    @Test
    @DisplayName("setTask without a run keeps an existing runId")
    void setTaskKeepsRun() {
        MdcContext.setRun("BAT-2026-0002");
        MdcContext.setTask(null, "TASK-001", "Writer");
        assertEquals("BAT-2026-0002", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes every Bat key")
    void clear() {
        MdcContext.setTask("BAT-2026-0001", "TASK-001", "Writer");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("agentRole"));
    }
}
