package com.voicepilot.core.llm;

import com.voicepilot.core.model.ResolvedCommand;

/**
 * Outcome of {@link GenerativeParser#parse(String)}: a validated command or a classified failure.
 */
public interface GenerationResult {

    boolean isSuccess();

    /**
     * @param command  the validated intent or plan
     * @param attempts how many service calls it took, starting at 1
     */
    record Success(ResolvedCommand command, int attempts) implements GenerationResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * @param kind   classification of the last failed attempt
     * @param detail diagnostic text, not for end users
     */
    record Failure(FailureKind kind, String detail) implements GenerationResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
