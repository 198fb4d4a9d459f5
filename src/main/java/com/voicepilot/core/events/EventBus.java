package com.voicepilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for resolution and execution events.
 * <p>
 * Listeners either follow one utterance or watch everything. A terminal event
 * ({@link EventType#isTerminal()}) releases the listeners of its utterance after delivery.
 * A listener that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<VoicePilotEvent>>> utteranceListeners =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<VoicePilotEvent>> globalListeners =
            new CopyOnWriteArrayList<>();

    /** Stamps and publishes an event. */
    public VoicePilotEvent publish(EventType type, String utteranceId, Integer stepIndex,
                                   Map<String, Object> payload) {
        VoicePilotEvent event = new VoicePilotEvent(type, utteranceId, stepIndex, payload, Instant.now());
        publish(event);
        return event;
    }

    public void publish(VoicePilotEvent event) {
        EventType type = event.eventType();
        if (event.isStepEvent()) {
            log.debug("{} step {} of {}", type.wireName(), event.stepIndex(), event.utteranceId());
        } else {
            log.debug("{} for {}", type.wireName(), event.utteranceId());
        }

        List<Consumer<VoicePilotEvent>> listeners = type.isTerminal()
                ? utteranceListeners.remove(event.utteranceId())
                : utteranceListeners.get(event.utteranceId());
        if (listeners != null) {
            listeners.forEach(listener -> deliver(listener, event));
        }
        globalListeners.forEach(listener -> deliver(listener, event));
    }

    /**
     * Follows one utterance until its run ends or the returned handle is used.
     */
    public Subscription subscribe(String utteranceId, Consumer<VoicePilotEvent> listener) {
        utteranceListeners.computeIfAbsent(utteranceId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> utteranceListeners.computeIfPresent(utteranceId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<VoicePilotEvent> listener) {
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    /** Number of utterances that currently have listeners. */
    int followedUtterances() {
        return utteranceListeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<VoicePilotEvent> listener, VoicePilotEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for {}: {}",
                    event.eventType().wireName(), event.utteranceId(), e.getMessage(), e);
        }
    }
}
