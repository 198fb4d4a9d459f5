package com.voicepilot.core.llm;

/**
 * One request to the generative service.
 *
 * @param model       provider model id
 * @param temperature sampling temperature
 * @param maxTokens   completion token cap
 * @param system      system instructions
 * @param user        user message
 */
public record CompletionRequest(
    String model,
    double temperature,
    int maxTokens,
    String system,
    String user
) {}
