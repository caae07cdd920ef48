package com.bat.core.task;

/**
 * A single attempt did not settle within the task's {@code timeoutMs}.
 */
public class TimeoutExceededException extends RuntimeException {

    private final long timeoutMs;

    public TimeoutExceededException(long timeoutMs) {
        super("Task timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
