package com.voicepilot.core.llm;

/**
 * Thrown when a completion does not arrive within the configured request timeout,
 * or the waiting thread is interrupted.
 */
public class LlmTimeoutException extends RuntimeException {

    public LlmTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
