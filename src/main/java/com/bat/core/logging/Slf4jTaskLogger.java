package com.bat.core.logging;

import com.bat.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * {@link TaskLogger} that writes through SLF4J and keeps a bounded history of formatted entries.
 */
public class Slf4jTaskLogger implements TaskLogger {

    private static final Logger log = LoggerFactory.getLogger(Slf4jTaskLogger.class);

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private final int historySize;
    private final Deque<String> history = new ArrayDeque<>();

    public Slf4jTaskLogger() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public Slf4jTaskLogger(int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must not be negative, was " + historySize);
        }
        this.historySize = historySize;
    }

    @Override
    public void logTaskExecution(String taskDescription, TaskStatus status, String detail) {
        String result = detail != null && !detail.isEmpty() ? "\nResult: " + detail : "";
        switch (status) {
            case FAILED -> log.error("TASK [{}]: {}{}", status, taskDescription, result);
            case RETRYING -> log.warn("TASK [{}]: {}{}", status, taskDescription, result);
            default -> log.info("TASK [{}]: {}{}", status, taskDescription, result);
        }
        remember("TASK [" + status.name() + "]: " + taskDescription + result);
    }

    @Override
    public void logAgentAction(String agentRole, String action) {
        log.info("AGENT [{}]: {}", agentRole, action);
        remember("AGENT [" + agentRole + "]: " + action);
    }

    /**
     * Returns a snapshot of the retained entries, oldest first, each prefixed with its timestamp.
     */
    public List<String> getLogs() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public void clearLogs() {
        synchronized (history) {
            history.clear();
        }
    }

    private void remember(String entry) {
        if (historySize == 0) {
            return;
        }
        synchronized (history) {
            history.addLast("[" + Instant.now() + "] " + entry);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }
}
