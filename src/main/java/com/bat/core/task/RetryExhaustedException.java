package com.bat.core.task;

/**
 * Final failure of a task after all attempts, carrying the attempt count and the last cause.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attemptCount;

    public RetryExhaustedException(int attemptCount, Throwable lastCause) {
        super("Task execution failed after " + attemptCount + " attempts: " + lastCause.getMessage(), lastCause);
        this.attemptCount = attemptCount;
    }

    public int getAttemptCount() {
        return attemptCount;
    }
}
