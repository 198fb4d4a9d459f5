package com.voicepilot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while resolving or running an utterance.
 *
 * @param eventType   what happened
 * @param utteranceId the utterance this event belongs to
 * @param stepIndex   1-based step index (nullable for utterance-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record VoicePilotEvent(
    EventType eventType,
    String utteranceId,
    Integer stepIndex,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public VoicePilotEvent {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType must not be null");
        }
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public boolean isStepEvent() {
        return stepIndex != null;
    }
}
