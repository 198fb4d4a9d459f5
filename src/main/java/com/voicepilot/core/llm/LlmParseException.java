package com.voicepilot.core.llm;

/**
 * Thrown when model output contains no parseable JSON object.
 */
public class LlmParseException extends RuntimeException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
