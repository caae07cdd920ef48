package com.bat.core.model;

/**
 * Retry behaviour of a task.
 *
 * @param maxRetries   total number of attempts allowed (1 means a single attempt, no retry)
 * @param retryDelayMs fixed pause between attempts, no backoff growth
 */
public record RetryConfig(int maxRetries, long retryDelayMs) {

    public static final RetryConfig DEFAULT = new RetryConfig(3, 1000);

    public RetryConfig {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, was " + maxRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must not be negative, was " + retryDelayMs);
        }
    }
}
