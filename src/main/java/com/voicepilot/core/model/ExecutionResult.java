package com.voicepilot.core.model;

import java.io.Serializable;

/**
 * Outcome of performing one {@link Intent}, produced by the actuator.
 */
public record ExecutionResult(
    boolean succeeded,
    String message,
    String output,
    String error
) implements Serializable {

    public ExecutionResult {
        message = message != null ? message : "";
        output = output != null ? output : "";
        error = error != null ? error : "";
    }

    public static ExecutionResult success(String message, String output) {
        return new ExecutionResult(true, message, output, "");
    }

    public static ExecutionResult failure(String message, String error) {
        return new ExecutionResult(false, message, "", error);
    }
}
