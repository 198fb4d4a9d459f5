package com.voicepilot.core.prompt;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One worked example shown to the model: an utterance and the JSON it should produce.
 */
public record FewShotExample(String user, JsonNode assistant) {}
