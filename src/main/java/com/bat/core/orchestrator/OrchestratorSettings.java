package com.bat.core.orchestrator;

import com.bat.core.model.Priority;
import com.bat.core.model.RetryConfig;
import com.bat.core.task.Task;

/**
 * Defaults applied by {@link Orchestrator#addTask} and the fan-out policy.
 *
 * @param maxConcurrency     0 or less launches every task at once; otherwise the size of a
 *                           worker pool fed from a priority queue
 * @param defaultPriority    priority of tasks added without one
 * @param defaultTimeoutMs   per-attempt timeout of tasks added without one
 * @param defaultRetryConfig retry behaviour of tasks added without one
 */
public record OrchestratorSettings(
    int maxConcurrency,
    Priority defaultPriority,
    long defaultTimeoutMs,
    RetryConfig defaultRetryConfig
) {

    public OrchestratorSettings {
        defaultPriority = defaultPriority == null ? Priority.MEDIUM : defaultPriority;
        defaultRetryConfig = defaultRetryConfig == null ? RetryConfig.DEFAULT : defaultRetryConfig;
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException("defaultTimeoutMs must be positive, was " + defaultTimeoutMs);
        }
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(0, Priority.MEDIUM, Task.DEFAULT_TIMEOUT_MS, RetryConfig.DEFAULT);
    }

    public boolean bounded() {
        return maxConcurrency > 0;
    }
}
