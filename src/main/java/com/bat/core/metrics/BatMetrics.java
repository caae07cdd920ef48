package com.bat.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task execution and agent decisions.
 */
@Service
public class BatMetrics {

    private final MeterRegistry registry;

    public BatMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String agentRole, long ms, String outcome) {
        Timer.builder("bat.task.duration")
                .tag("agent", agentRole)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param reason "timeout" or "error"
     */
    public void recordFailedAttempt(String agentRole, String reason) {
        Counter.builder("bat.task.failed_attempts")
                .description("Task attempts that raised or timed out")
                .tag("agent", agentRole)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param path "tool", "delegation" or "direct"
     */
    public void recordDecision(String agentRole, String path) {
        Counter.builder("bat.agent.decisions")
                .tag("agent", agentRole)
                .tag("path", path)
                .register(registry)
                .increment();
    }

    public void recordToolInvocation(String toolName, boolean success) {
        Counter.builder("bat.tool.invocations")
                .tag("tool", toolName)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordDelegation(String fromRole, String toRole) {
        Counter.builder("bat.agent.delegations")
                .tag("from", fromRole)
                .tag("to", toRole)
                .register(registry)
                .increment();
    }

    /**
     * Oracle replies that violated their schema, by reply kind
     * ("tool_selection", "capability", "delegation").
     */
    public void recordUnparseableReply(String kind) {
        Counter.builder("bat.oracle.unparseable_replies")
                .description("Oracle replies that could not be decoded")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordKickoff(int taskCount, long failedCount) {
        Counter.builder("bat.kickoff.runs")
                .register(registry)
                .increment();
        DistributionSummary.builder("bat.kickoff.tasks")
                .description("Tasks per kickoff")
                .register(registry)
                .record(taskCount);
        DistributionSummary.builder("bat.kickoff.failed_tasks")
                .register(registry)
                .record(failedCount);
    }
}
