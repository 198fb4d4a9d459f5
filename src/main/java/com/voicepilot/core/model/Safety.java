package com.voicepilot.core.model;

import java.io.Serializable;

/**
 * Risk classification attached to every {@link Intent}.
 *
 * @param risk   the risk level, never null
 * @param reason why the level was assigned (may be empty)
 */
public record Safety(
    RiskLevel risk,
    String reason
) implements Serializable {

    public Safety {
        if (risk == null) {
            throw new IllegalArgumentException("risk must not be null");
        }
        reason = reason != null ? reason : "";
    }

    public static Safety low(String reason) {
        return new Safety(RiskLevel.LOW, reason);
    }

    public static Safety high(String reason) {
        return new Safety(RiskLevel.HIGH, reason);
    }
}
