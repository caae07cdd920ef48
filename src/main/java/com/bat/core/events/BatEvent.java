package com.bat.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a kickoff run.
 *
 * @param eventType e.g. "run.started", "task.started", "task.completed", "task.failed", "run.completed"
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (null for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record BatEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static BatEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new BatEvent(eventType, runId, taskId, payload, Instant.now());
    }
}
