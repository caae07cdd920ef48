package com.bat.core.task;

import com.bat.core.agent.Agent;
import com.bat.core.model.Priority;
import com.bat.core.model.RetryConfig;
import com.bat.core.model.TaskStatus;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A unit of work bound to one agent, with priority, per-attempt timeout and retry configuration.
 * <p>
 * The agent is borrowed for the task's lifetime. Status and attempt count are updated by
 * {@link TaskExecutor}; everything else is fixed at construction.
 */
public class Task {

    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    private final String id;
    private final String description;
    private final Agent agent;
    private final Priority priority;
    private final long timeoutMs;
    private final RetryConfig retryConfig;

    private final AtomicInteger attemptCount = new AtomicInteger();
    private volatile TaskStatus status = TaskStatus.PENDING;

    public Task(String description, Agent agent) {
        this(description, agent, Priority.MEDIUM);
    }

    public Task(String description, Agent agent, Priority priority) {
        this("TASK-" + UUID.randomUUID().toString().substring(0, 8), description, agent,
                priority, DEFAULT_TIMEOUT_MS, RetryConfig.DEFAULT);
    }

    public Task(String id, String description, Agent agent, Priority priority,
                long timeoutMs, RetryConfig retryConfig) {
        if (agent == null) {
            throw new IllegalArgumentException("Task '" + description + "' has no agent");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, was " + timeoutMs);
        }
        this.id = id;
        this.description = description;
        this.agent = agent;
        this.priority = priority == null ? Priority.MEDIUM : priority;
        this.timeoutMs = timeoutMs;
        this.retryConfig = retryConfig == null ? RetryConfig.DEFAULT : retryConfig;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public Agent getAgent() {
        return agent;
    }

    public Priority getPriority() {
        return priority;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public RetryConfig getRetryConfig() {
        return retryConfig;
    }

    public int getAttemptCount() {
        return attemptCount.get();
    }

    public TaskStatus getStatus() {
        return status;
    }

    void resetAttempts() {
        attemptCount.set(0);
    }

    int recordFailedAttempt() {
        return attemptCount.incrementAndGet();
    }

    void setStatus(TaskStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "Task[" + id + ", " + priority + ", " + agent.getRole() + ": " + description + "]";
    }
}
