package com.bat.core.logging;

import com.bat.core.model.TaskStatus;

/**
 * Execution log passed explicitly into the orchestrator and task executor.
 */
public interface TaskLogger {

    /**
     * @param detail result, error or retry note; nullable
     */
    void logTaskExecution(String taskDescription, TaskStatus status, String detail);

    default void logTaskExecution(String taskDescription, TaskStatus status) {
        logTaskExecution(taskDescription, status, null);
    }

    void logAgentAction(String agentRole, String action);
}
