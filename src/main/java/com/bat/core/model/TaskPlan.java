package com.bat.core.model;

import java.util.List;

/**
 * Inbound batch of tasks for one kickoff, as read from a plan file or the REST API.
 */
public record TaskPlan(List<TaskRequest> tasks) {

    public TaskPlan {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
