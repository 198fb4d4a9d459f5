package com.voicepilot.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private final EventBus bus = new EventBus();

    @Test
    @DisplayName("per-utterance listeners only see their utterance")
    void perUtterance() {
        List<VoicePilotEvent> received = new ArrayList<>();
        bus.subscribe("UTT-1", received::add);

        bus.publish(EventType.STEP_STARTED, "UTT-1", 1, Map.of("intent", "web_search"));
        bus.publish(EventType.STEP_STARTED, "UTT-2", 1, Map.of());

        assertEquals(1, received.size());
        assertEquals("UTT-1", received.get(0).utteranceId());
        assertTrue(received.get(0).isStepEvent());
        assertEquals("web_search", received.get(0).payload().get("intent"));
    }

    @Test
    @DisplayName("global listeners see every event")
    void global() {
        List<VoicePilotEvent> received = new ArrayList<>();
        bus.subscribeAll(received::add);

        bus.publish(EventType.UTTERANCE_RESOLVED, "UTT-1", null, Map.of());
        bus.publish(EventType.RUN_COMPLETED, "UTT-2", null, Map.of());

        assertEquals(List.of(EventType.UTTERANCE_RESOLVED, EventType.RUN_COMPLETED),
                received.stream().map(VoicePilotEvent::eventType).toList());
    }

    @Test
    @DisplayName("a terminal event is delivered and then releases the utterance's listeners")
    void terminalReleasesListeners() {
        List<EventType> received = new ArrayList<>();
        bus.subscribe("UTT-1", e -> received.add(e.eventType()));

        bus.publish(EventType.STEP_FAILED, "UTT-1", 2, Map.of());
        bus.publish(EventType.RUN_ABORTED, "UTT-1", null, Map.of("outcome", "FAILED"));
        bus.publish(EventType.STEP_STARTED, "UTT-1", 1, Map.of());

        assertEquals(List.of(EventType.STEP_FAILED, EventType.RUN_ABORTED), received);
        assertEquals(0, bus.followedUtterances());
    }

    @Test
    @DisplayName("unsubscribing removes the listener and forgets an empty utterance")
    void unsubscribe() {
        List<VoicePilotEvent> received = new ArrayList<>();
        EventBus.Subscription subscription = bus.subscribe("UTT-1", received::add);
        EventBus.Subscription global = bus.subscribeAll(received::add);

        subscription.unsubscribe();
        global.unsubscribe();
        bus.publish(EventType.STEP_STARTED, "UTT-1", 1, Map.of());

        assertTrue(received.isEmpty());
        assertEquals(0, bus.followedUtterances());
    }

    @Test
    @DisplayName("unsubscribing after the run ended is harmless")
    void unsubscribeAfterTerminal() {
        EventBus.Subscription subscription = bus.subscribe("UTT-1", e -> { });
        bus.publish(EventType.RUN_COMPLETED, "UTT-1", null, Map.of());

        assertDoesNotThrow(subscription::unsubscribe);
        assertEquals(0, bus.followedUtterances());
    }

    @Test
    @DisplayName("a throwing listener does not affect the others")
    void throwingListener() {
        List<VoicePilotEvent> received = new ArrayList<>();
        bus.subscribe("UTT-1", e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe("UTT-1", received::add);

        assertDoesNotThrow(() -> bus.publish(EventType.STEP_FAILED, "UTT-1", 1, Map.of()));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("events require a type and copy their payload")
    void eventConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new VoicePilotEvent(null, "UTT-1", null, Map.of(), Instant.now()));
        VoicePilotEvent event = new VoicePilotEvent(EventType.RUN_COMPLETED, "UTT-1", null, null,
                Instant.now());
        assertTrue(event.payload().isEmpty());
        assertTrue(EventType.RUN_ABORTED.isTerminal());
        assertFalse(EventType.STEP_COMPLETED.isTerminal());
        assertEquals("utterance.resolved", EventType.UTTERANCE_RESOLVED.wireName());
    }
}
