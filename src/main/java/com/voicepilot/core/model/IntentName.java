package com.voicepilot.core.model;

import java.util.Optional;

/**
 * Closed set of command names an utterance can resolve to.
 */
public enum IntentName {
    SYSTEM_SETTING("system_setting"),
    PLAY_MUSIC("play_music"),
    WEB_SEARCH("web_search"),
    WRITE_NOTE("write_note"),
    CONTROL_APP("control_app"),
    CLARIFY("clarify");

    private final String wireName;

    IntentName(String wireName) {
        this.wireName = wireName;
    }

    /** The snake_case name used in JSON payloads and prompts. */
    public String wireName() {
        return wireName;
    }

    public static Optional<IntentName> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (IntentName name : values()) {
            if (name.wireName.equals(trimmed)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
