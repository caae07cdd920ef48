package com.bat.core.model;

/**
 * Outcome of one task after a kickoff, in priority order.
 *
 * @param taskId      orchestrator-assigned id (e.g. "TASK-001")
 * @param description task description
 * @param agentRole   role of the assigned agent
 * @param priority    task priority
 * @param status      COMPLETED or FAILED
 * @param attempts    failed attempts counted by the executor
 * @param result      the result string, or the failure message
 */
public record TaskReport(
    String taskId,
    String description,
    String agentRole,
    Priority priority,
    TaskStatus status,
    int attempts,
    String result
) {
}
