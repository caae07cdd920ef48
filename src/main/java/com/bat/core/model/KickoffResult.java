package com.bat.core.model;

import java.util.List;

/**
 * Everything a kickoff produced: the positional result list plus per-task reports in the same order.
 */
public record KickoffResult(String runId, List<String> results, List<TaskReport> tasks) {

    public long failedCount() {
        return tasks.stream().filter(t -> t.status() == TaskStatus.FAILED).count();
    }
}
