package com.bat.core.model;

/**
 * Lifecycle status of a task within a single run.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    RETRYING,
    COMPLETED,
    FAILED
}
