package com.bat.core.model;

/**
 * One entry of a {@link TaskPlan}. Everything except description and agent role is optional
 * and falls back to the configured task defaults.
 *
 * @param description free-text description of the work
 * @param agentRole   role of the managed agent that should run it
 * @param priority    high, medium or low; nullable
 * @param timeoutMs   per-attempt timeout; nullable
 * @param retryConfig retry behaviour; nullable
 */
public record TaskRequest(
    String description,
    String agentRole,
    String priority,
    Long timeoutMs,
    RetryConfig retryConfig
) {

    public TaskRequest(String description, String agentRole) {
        this(description, agentRole, null, null, null);
    }
}
