package com.bat.core.orchestrator;

import com.bat.core.agent.Agent;
import com.bat.core.events.BatEvent;
import com.bat.core.events.EventBus;
import com.bat.core.logging.MdcContext;
import com.bat.core.logging.TaskLogger;
import com.bat.core.model.Priority;
import com.bat.core.model.RetryConfig;
import com.bat.core.model.TaskRequest;
import com.bat.core.model.TaskStatus;
import com.bat.core.task.Task;
import com.bat.core.task.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns a collection of tasks over a fixed set of agents, orders them by priority and runs them
 * concurrently. A failing task never aborts the batch; its failure becomes a string at its
 * position in the result list.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    /** Weight descending; {@link List#sort} is stable, so equal weights keep insertion order. */
    static final Comparator<Task> BY_PRIORITY =
            Comparator.comparingInt((Task t) -> t.getPriority().weight()).reversed();

    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final List<Task> tasks = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger taskSequence = new AtomicInteger();
    private final TaskExecutor executor;
    private final TaskLogger taskLogger;
    private final OrchestratorSettings settings;
    private final EventBus eventBus;

    public Orchestrator(List<Agent> agents, TaskExecutor executor, TaskLogger taskLogger) {
        this(agents, executor, taskLogger, OrchestratorSettings.defaults(), null);
    }

    public Orchestrator(List<Agent> agents, TaskExecutor executor, TaskLogger taskLogger,
                        OrchestratorSettings settings, EventBus eventBus) {
        for (Agent agent : agents) {
            if (this.agents.putIfAbsent(agent.getRole(), agent) != null) {
                throw new IllegalArgumentException("Duplicate agent role: " + agent.getRole());
            }
        }
        this.executor = executor;
        this.taskLogger = taskLogger;
        this.settings = settings;
        this.eventBus = eventBus;
    }

    public Task addTask(String description, String agentRole) {
        return addTask(description, agentRole, null, null, null);
    }

    public Task addTask(String description, String agentRole, Priority priority) {
        return addTask(description, agentRole, priority, null, null);
    }

    /**
     * Adds a task for the agent with {@code agentRole}. Null optional arguments take the
     * configured defaults.
     *
     * @throws AgentNotFoundException if no managed agent has that role
     */
    public Task addTask(String description, String agentRole, Priority priority,
                        Long timeoutMs, RetryConfig retryConfig) {
        Agent agent = agents.get(agentRole);
        if (agent == null) {
            throw new AgentNotFoundException(agentRole);
        }
        var task = new Task(
                String.format("TASK-%03d", taskSequence.incrementAndGet()),
                description,
                agent,
                priority != null ? priority : settings.defaultPriority(),
                timeoutMs != null ? timeoutMs : settings.defaultTimeoutMs(),
                retryConfig != null ? retryConfig : settings.defaultRetryConfig());
        tasks.add(task);
        log.debug("Added {}", task);
        return task;
    }

    public Task addTask(TaskRequest request) {
        Priority priority = request.priority() == null ? null : Priority.parse(request.priority());
        return addTask(request.description(), request.agentRole(), priority,
                request.timeoutMs(), request.retryConfig());
    }

    public List<Agent> getAgents() {
        return List.copyOf(agents.values());
    }

    /** Tasks in insertion order. */
    public List<Task> getTasks() {
        synchronized (tasks) {
            return List.copyOf(tasks);
        }
    }

    /** Tasks in the order {@link #kickoff()} reports them. */
    public List<Task> prioritizedTasks() {
        var sorted = new ArrayList<>(getTasks());
        sorted.sort(BY_PRIORITY);
        return sorted;
    }

    public List<String> kickoff() {
        return kickoff(null);
    }

    /**
     * Runs every task and waits for all of them to settle.
     *
     * @param runId id stamped on events and MDC; nullable
     * @return one entry per task in priority order: the result, or {@code "Task failed: ..."}
     */
    public List<String> kickoff(String runId) {
        List<Task> ordered = prioritizedTasks();
        int count = ordered.size();
        String[] results = new String[count];
        if (count == 0) {
            return List.of();
        }

        int workerCount = settings.bounded() ? Math.min(settings.maxConcurrency(), count) : count;
        log.info("Kicking off {} tasks with {} workers", count, workerCount);
        publish("run.started", runId, null, Map.of("taskCount", count, "workers", workerCount));

        var queue = new PriorityBlockingQueue<Slot>(count, Slot.ADMISSION_ORDER);
        for (int i = 0; i < count; i++) {
            queue.add(new Slot(i, ordered.get(i)));
        }

        var threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "bat-task-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var workers = new ArrayList<CompletableFuture<Void>>();
            for (int w = 0; w < workerCount; w++) {
                workers.add(CompletableFuture.runAsync(() -> {
                    Slot slot;
                    while ((slot = queue.poll()) != null) {
                        results[slot.index()] = runOne(slot.task(), runId);
                    }
                }, pool));
            }
            CompletableFuture.allOf(workers.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdown();
        }

        long failed = ordered.stream().filter(t -> t.getStatus() == TaskStatus.FAILED).count();
        publish("run.completed", runId, null, Map.of("taskCount", count, "failed", failed));
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    private String runOne(Task task, String runId) {
        Agent agent = task.getAgent();
        MdcContext.setTask(runId, task.getId(), agent.getRole());
        try {
            taskLogger.logAgentAction(agent.getRole(), "Executing " + task.getId() + ": " + task.getDescription());
            publish("task.started", runId, task.getId(),
                    Map.of("agent", agent.getRole(), "priority", task.getPriority().name()));
            String result = executor.run(task, delegatesFor(agent));
            publish("task.completed", runId, task.getId(),
                    Map.of("agent", agent.getRole(), "attempts", task.getAttemptCount()));
            return result;
        } catch (RuntimeException e) {
            log.error("Task {} failed: {}", task.getId(), e.getMessage());
            publish("task.failed", runId, task.getId(),
                    Map.of("agent", agent.getRole(), "error", String.valueOf(e.getMessage())));
            return "Task failed: " + e.getMessage();
        } finally {
            MdcContext.clear();
        }
    }

    /** Every managed agent except the task's own. */
    private List<Agent> delegatesFor(Agent agent) {
        return agents.values().stream()
                .filter(a -> a != agent)
                .toList();
    }

    private void publish(String type, String runId, String taskId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(BatEvent.of(type, runId, taskId, payload));
        }
    }

    private record Slot(int index, Task task) {
        static final Comparator<Slot> ADMISSION_ORDER = Comparator
                .comparingInt((Slot s) -> s.task().getPriority().weight()).reversed()
                .thenComparingInt(Slot::index);
    }
}
