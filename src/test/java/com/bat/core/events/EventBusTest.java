package com.bat.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private BatEvent event(String type, String runId) {
        return BatEvent.of(type, runId, null, Map.of());
    }

    @Nested
    @DisplayName("Listeners")
    class Listeners {

        @Test
        @DisplayName("a listener only receives its own run's events")
        void perRun() {
            var received = new ArrayList<BatEvent>();
            eventBus.subscribe("BAT-1", received::add);

            eventBus.publish(event("run.started", "BAT-1"));
            eventBus.publish(event("run.started", "BAT-2"));

            assertEquals(1, received.size());
            assertEquals("BAT-1", received.get(0).runId());
        }

        @Test
        @DisplayName("closing the subscription stops delivery")
        void close() {
            var received = new ArrayList<BatEvent>();
            try (var subscription = eventBus.subscribe("BAT-1", received::add)) {
                eventBus.publish(event("run.started", "BAT-1"));
            }

            eventBus.publish(event("run.completed", "BAT-1"));

            assertEquals(List.of("run.started"), received.stream().map(BatEvent::eventType).toList());
        }

        @Test
        @DisplayName("a throwing listener does not affect the others")
        void throwingListener() {
            var received = new ArrayList<BatEvent>();
            eventBus.subscribe("BAT-1", e -> {
                throw new IllegalStateException("bad listener");
            });
            eventBus.subscribe("BAT-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("run.completed", "BAT-1")));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("subscribing without a run id is rejected")
        void nullRun() {
            assertThrows(IllegalArgumentException.class, () -> eventBus.subscribe(null, e -> {}));
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("events are kept per run in publish order")
        void ordered() {
            eventBus.publish(event("run.started", "BAT-1"));
            eventBus.publish(event("task.started", "BAT-1"));
            eventBus.publish(event("run.started", "BAT-2"));

            assertEquals(List.of("run.started", "task.started"),
                    eventBus.history("BAT-1").stream().map(BatEvent::eventType).toList());
            assertTrue(eventBus.history("BAT-9").isEmpty());
        }

        @Test
        @DisplayName("events without a run id are not recorded")
        void noRunId() {
            eventBus.publish(event("task.started", null));

            assertTrue(eventBus.history(null).isEmpty());
        }

        @Test
        @DisplayName("the oldest run is evicted past the retention limit")
        void eviction() {
            var bus = new EventBus(2);
            bus.publish(event("run.started", "BAT-1"));
            bus.publish(event("run.started", "BAT-2"));
            bus.publish(event("run.started", "BAT-3"));

            assertTrue(bus.history("BAT-1").isEmpty());
            assertEquals(1, bus.history("BAT-2").size());
            assertEquals(1, bus.history("BAT-3").size());
        }

        @Test
        @DisplayName("a retention limit below one is rejected")
        void invalidLimit() {
            assertThrows(IllegalArgumentException.class, () -> new EventBus(0));
        }
    }
}
