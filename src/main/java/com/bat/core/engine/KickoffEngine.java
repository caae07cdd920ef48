package com.bat.core.engine;

import com.bat.config.BatProperties;
import com.bat.core.agent.AgentRegistry;
import com.bat.core.events.EventBus;
import com.bat.core.logging.MdcContext;
import com.bat.core.logging.TaskLogger;
import com.bat.core.metrics.BatMetrics;
import com.bat.core.model.KickoffResult;
import com.bat.core.model.TaskPlan;
import com.bat.core.model.TaskReport;
import com.bat.core.model.TaskRequest;
import com.bat.core.orchestrator.Orchestrator;
import com.bat.core.task.Task;
import com.bat.core.task.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link TaskPlan} against the registered agents.
 * <p>
 * Each run gets a fresh {@link Orchestrator} over the shared agents and task executor,
 * a generated run id, and a report per task in priority order.
 */
@Service
public class KickoffEngine {

    private static final Logger log = LoggerFactory.getLogger(KickoffEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final AgentRegistry registry;
    private final TaskExecutor executor;
    private final TaskLogger taskLogger;
    private final BatProperties properties;
    private final EventBus eventBus;
    private final BatMetrics metrics;

    public KickoffEngine(AgentRegistry registry, TaskExecutor executor, TaskLogger taskLogger,
                         BatProperties properties, EventBus eventBus, BatMetrics metrics) {
        this.registry = registry;
        this.executor = executor;
        this.taskLogger = taskLogger;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public KickoffResult run(TaskPlan plan) {
        return run(generateRunId(), plan);
    }

    /**
     * @throws com.bat.core.orchestrator.AgentNotFoundException if a request names an unknown role
     * @throws IllegalArgumentException                         for an empty plan or an invalid priority
     */
    public KickoffResult run(String runId, TaskPlan plan) {
        if (plan.tasks().isEmpty()) {
            throw new IllegalArgumentException("Plan contains no tasks");
        }
        MdcContext.setRun(runId);
        try {
            var orchestrator = new Orchestrator(registry.all(), executor, taskLogger,
                    properties.toOrchestratorSettings(), eventBus);
            for (TaskRequest request : plan.tasks()) {
                orchestrator.addTask(request);
            }
            log.info("Starting run {} with {} tasks", runId, plan.tasks().size());

            List<Task> ordered = orchestrator.prioritizedTasks();
            List<String> results = orchestrator.kickoff(runId);

            var reports = new ArrayList<TaskReport>(ordered.size());
            for (int i = 0; i < ordered.size(); i++) {
                Task task = ordered.get(i);
                reports.add(new TaskReport(task.getId(), task.getDescription(), task.getAgent().getRole(),
                        task.getPriority(), task.getStatus(), task.getAttemptCount(), results.get(i)));
            }
            var result = new KickoffResult(runId, results, List.copyOf(reports));
            metrics.recordKickoff(reports.size(), result.failedCount());
            log.info("Run {} finished: {} tasks, {} failed", runId, reports.size(), result.failedCount());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a run id in the format BAT-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("BAT-%d-%04d", year, count);
    }
}
