package com.bat.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatMetricsTest {

    private SimpleMeterRegistry registry;
    private BatMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new BatMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskExecution records a timer by agent and outcome")
    void taskExecution() {
        metrics.recordTaskExecution("Writer", 1200, "completed");
        var timer = registry.find("bat.task.duration").tag("agent", "Writer").tag("outcome", "completed").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("failed attempts are counted by reason")
    void failedAttempts() {
        metrics.recordFailedAttempt("Writer", "timeout");
        metrics.recordFailedAttempt("Writer", "timeout");
        metrics.recordFailedAttempt("Writer", "error");

        assertEquals(2.0, registry.find("bat.task.failed_attempts").tag("reason", "timeout").counter().count());
        assertEquals(1.0, registry.find("bat.task.failed_attempts").tag("reason", "error").counter().count());
    }

    @Test
    @DisplayName("unparseable replies are counted apart from decisions")
    void unparseable() {
        metrics.recordUnparseableReply("delegation");
        metrics.recordDecision("Writer", "direct");

        assertEquals(1.0, registry.find("bat.oracle.unparseable_replies").tag("kind", "delegation").counter().count());
        assertEquals(1.0, registry.find("bat.agent.decisions").tag("path", "direct").counter().count());
    }

    @Test
    @DisplayName("tool invocations and delegations are tagged")
    void toolsAndDelegations() {
        metrics.recordToolInvocation("weather", false);
        metrics.recordDelegation("Researcher", "Writer");

        assertEquals(1.0, registry.find("bat.tool.invocations").tag("success", "false").counter().count());
        assertEquals(1.0, registry.find("bat.agent.delegations").tag("from", "Researcher").counter().count());
    }

    @Test
    @DisplayName("recordKickoff tracks runs and task counts")
    void kickoff() {
        metrics.recordKickoff(3, 1);

        assertEquals(1.0, registry.find("bat.kickoff.runs").counter().count());
        assertEquals(3.0, registry.find("bat.kickoff.tasks").summary().totalAmount());
        assertEquals(1.0, registry.find("bat.kickoff.failed_tasks").summary().totalAmount());
    }
}
