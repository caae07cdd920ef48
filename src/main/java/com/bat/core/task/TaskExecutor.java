package com.bat.core.task;

import com.bat.core.agent.Agent;
import com.bat.core.agent.CancellationToken;
import com.bat.core.agent.DelegationChain;
import com.bat.core.agent.ExecutionContext;
import com.bat.core.agent.TaskCancelledException;
import com.bat.core.logging.TaskLogger;
import com.bat.core.metrics.BatMetrics;
import com.bat.core.model.RetryConfig;
import com.bat.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a task's agent with a per-attempt deadline and a bounded, fixed-delay retry loop.
 * <p>
 * Each attempt runs on a worker thread. When the deadline passes, the attempt's
 * {@link CancellationToken} is cancelled and the worker interrupted, so the agent stops at
 * its next oracle query or tool call. The delay between attempts does not count against
 * the deadline.
 */
public class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final TaskLogger taskLogger;
    private final BatMetrics metrics;
    private final int maxDelegationDepth;
    private final ExecutorService workers;

    public TaskExecutor(TaskLogger taskLogger) {
        this(taskLogger, null, DelegationChain.DEFAULT_MAX_DEPTH);
    }

    public TaskExecutor(TaskLogger taskLogger, BatMetrics metrics, int maxDelegationDepth) {
        this.taskLogger = taskLogger;
        this.metrics = metrics;
        this.maxDelegationDepth = maxDelegationDepth;
        this.workers = Executors.newCachedThreadPool(new AttemptThreadFactory());
    }

    public String run(Task task) {
        return run(task, List.of());
    }

    /**
     * Runs the task until an attempt succeeds or {@code maxRetries} attempts have failed.
     *
     * @param availableAgents delegation candidates for the task's agent
     * @throws RetryExhaustedException once the last attempt has failed
     * @throws TaskCancelledException  if the calling thread is interrupted
     */
    public String run(Task task, List<Agent> availableAgents) {
        RetryConfig retry = task.getRetryConfig();
        String role = task.getAgent().getRole();
        task.resetAttempts();
        taskLogger.logTaskExecution(task.getDescription(), TaskStatus.RUNNING);

        while (true) {
            task.setStatus(TaskStatus.RUNNING);
            long start = System.currentTimeMillis();
            try {
                String result = attempt(task, availableAgents);
                task.setStatus(TaskStatus.COMPLETED);
                taskLogger.logTaskExecution(task.getDescription(), TaskStatus.COMPLETED, result);
                if (metrics != null) {
                    metrics.recordTaskExecution(role, System.currentTimeMillis() - start, "completed");
                }
                return result;
            } catch (TaskCancelledException e) {
                task.setStatus(TaskStatus.FAILED);
                taskLogger.logTaskExecution(task.getDescription(), TaskStatus.FAILED, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                int attempts = task.recordFailedAttempt();
                if (metrics != null) {
                    metrics.recordFailedAttempt(role, e instanceof TimeoutExceededException ? "timeout" : "error");
                    metrics.recordTaskExecution(role, System.currentTimeMillis() - start, "failed");
                }
                if (attempts >= retry.maxRetries()) {
                    task.setStatus(TaskStatus.FAILED);
                    var exhausted = new RetryExhaustedException(attempts, e);
                    taskLogger.logTaskExecution(task.getDescription(), TaskStatus.FAILED, exhausted.getMessage());
                    throw exhausted;
                }
                task.setStatus(TaskStatus.RETRYING);
                taskLogger.logTaskExecution(task.getDescription(), TaskStatus.RETRYING,
                        "Attempt " + attempts + "/" + retry.maxRetries() + ": " + e.getMessage());
                log.debug("Attempt {} of task {} failed", attempts, task.getId(), e);
                pause(retry.retryDelayMs());
            }
        }
    }

    private String attempt(Task task, List<Agent> availableAgents) {
        Agent agent = task.getAgent();
        var token = new CancellationToken();
        var context = ExecutionContext.forAgent(agent, availableAgents, token, maxDelegationDepth);
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Future<String> future = workers.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return agent.execute(task.getDescription(), context);
            } finally {
                MDC.clear();
            }
        });

        try {
            return future.get(task.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            var timeout = new TimeoutExceededException(task.getTimeoutMs());
            token.cancel(timeout.getMessage());
            future.cancel(true);
            throw timeout;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("Interrupted");
            future.cancel(true);
            throw new TaskCancelledException("Interrupted while waiting for task " + task.getId());
        }
    }

    private static void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted between attempts");
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static final class AttemptThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "bat-attempt-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
