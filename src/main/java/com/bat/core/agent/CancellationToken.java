package com.bat.core.agent;

/**
 * Cooperative cancellation flag shared by one attempt's oracle queries and tool calls.
 * Also honours the interrupt flag of the current thread.
 */
public final class CancellationToken {

    private volatile boolean cancelled;
    private volatile String reason = "Cancelled";

    public void cancel(String reason) {
        this.reason = reason;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new TaskCancelledException(reason);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new TaskCancelledException("Interrupted");
        }
    }
}
