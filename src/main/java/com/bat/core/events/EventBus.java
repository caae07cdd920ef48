package com.bat.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes kickoff lifecycle events to the listeners of their run and keeps the events of the
 * most recent runs for later inspection.
 * <p>
 * Listeners are called on the thread that publishes, usually a task worker.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_RETAINED_RUNS = 50;

    private final Map<String, CopyOnWriteArrayList<Consumer<BatEvent>>> listeners = new ConcurrentHashMap<>();
    private final Map<String, List<BatEvent>> history;

    public EventBus() {
        this(DEFAULT_RETAINED_RUNS);
    }

    /**
     * @param retainedRuns runs whose events are kept; the oldest run is evicted first
     */
    public EventBus(int retainedRuns) {
        if (retainedRuns < 1) {
            throw new IllegalArgumentException("retainedRuns must be at least 1, was " + retainedRuns);
        }
        this.history = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<BatEvent>> eldest) {
                return size() > retainedRuns;
            }
        };
    }

    /**
     * Records the event under its run and hands it to that run's listeners.
     * Events without a run id are only logged.
     */
    public void publish(BatEvent event) {
        log.debug("Event {} for run {} task {}", event.eventType(), event.runId(), event.taskId());
        if (event.runId() == null) {
            return;
        }
        synchronized (history) {
            history.computeIfAbsent(event.runId(), k -> new ArrayList<>()).add(event);
        }
        List<Consumer<BatEvent>> runListeners = listeners.get(event.runId());
        if (runListeners == null) {
            return;
        }
        for (Consumer<BatEvent> listener : runListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener for run {} failed on {}: {}", event.runId(), event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for the events of one run. Close the returned handle once the
     * run is over.
     */
    public Subscription subscribe(String runId, Consumer<BatEvent> listener) {
        if (runId == null) {
            throw new IllegalArgumentException("runId is required");
        }
        listeners.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> listeners.computeIfPresent(runId, (k, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
    }

    /** Events recorded for the run, oldest first; empty for an unknown or evicted run. */
    public List<BatEvent> history(String runId) {
        synchronized (history) {
            List<BatEvent> events = history.get(runId);
            return events == null ? List.of() : List.copyOf(events);
        }
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}
