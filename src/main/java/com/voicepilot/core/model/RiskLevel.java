package com.voicepilot.core.model;

import java.util.Optional;

/**
 * Safety classification of an intent. Governs whether confirmation is mandatory.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RiskLevel> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        for (RiskLevel level : values()) {
            if (level.wireName.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
