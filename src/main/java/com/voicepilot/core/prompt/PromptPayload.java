package com.voicepilot.core.prompt;

/**
 * A fully assembled request for the generative service.
 *
 * @param system instructions
 * @param user   few-shot block followed by the utterance
 */
public record PromptPayload(String system, String user) {}
