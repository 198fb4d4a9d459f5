package com.voicepilot.core.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the system and user messages sent to the generative service.
 * <p>
 * The system prompt and few-shot examples are read once at construction and shared
 * read-only afterwards. A missing system prompt resource falls back to a built-in prompt;
 * a missing few-shot resource means no examples. Malformed few-shot lines are skipped.
 */
@Component
public class PromptAssembler {

    private static final Logger log = LoggerFactory.getLogger(PromptAssembler.class);

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are a Command Planner for a desktop voice assistant.

            Your ONLY job is to output valid JSON with this exact structure:
            {
              "intent": "system_setting|play_music|web_search|write_note|control_app|clarify",
              "slots": {},
              "confirm": false,
              "speak_back": "",
              "safety": {"risk": "low|medium|high", "reason": ""}
            }

            For a request with several tasks output {"steps": [<intent>, ...], "summary": "..."}.

            Rules:
            1. Output ONLY minified JSON, no markdown, no prose, no explanations
            2. If user request is unsafe/ambiguous -> intent="clarify", confirm=true, brief speak_back
            3. For dangerous operations (delete/format/shutdown) -> safety.risk="high"
            4. speak_back should be brief (< 20 words) in user's language
            5. slots contain extracted parameters as key-value pairs""";

    static final String CORRECTIVE_PREFIX =
            "The previous output was invalid. Please output ONLY valid JSON matching the schema. User request: ";

    private final String systemPrompt;
    private final List<FewShotExample> examples;
    private final String fewShotBlock;

    public PromptAssembler(PromptProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.systemPrompt = loadSystemPrompt(resourceLoader.getResource(properties.getSystemPrompt()));
        this.examples = loadExamples(resourceLoader.getResource(properties.getFewShot()), objectMapper);
        this.fewShotBlock = formatExamples(examples);
        log.info("Prompt assembler loaded {} few-shot example(s)", examples.size());
    }

    /** The first-attempt prompt for {@code text}. */
    public PromptPayload assemble(String text) {
        String user = fewShotBlock + "\n\nNow parse this user request:\nUser: " + text + "\n\nOutput only JSON:";
        return new PromptPayload(systemPrompt, user);
    }

    /** The prompt used after the model produced unparseable or invalid output. */
    public PromptPayload corrective(String text) {
        return new PromptPayload(systemPrompt, CORRECTIVE_PREFIX + text);
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public List<FewShotExample> getExamples() {
        return examples;
    }

    private static String loadSystemPrompt(Resource resource) {
        if (!resource.exists()) {
            log.info("System prompt {} not found, using built-in prompt", resource.getDescription());
            return DEFAULT_SYSTEM_PROMPT;
        }
        try {
            String content = resource.getContentAsString(StandardCharsets.UTF_8).strip();
            return content.isEmpty() ? DEFAULT_SYSTEM_PROMPT : content;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read system prompt " + resource.getDescription(), e);
        }
    }

    private static List<FewShotExample> loadExamples(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            return List.of();
        }
        var loaded = new ArrayList<FewShotExample>();
        try (var reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    JsonNode node = objectMapper.readTree(line);
                    if (!node.isObject() || !node.path("user").isTextual() || !node.path("assistant").isObject()) {
                        log.warn("Skipping few-shot line {}: needs a text \"user\" and an object \"assistant\"", lineNumber);
                        continue;
                    }
                    loaded.add(new FewShotExample(node.get("user").asText(), node.get("assistant")));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed few-shot line {}: {}", lineNumber, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read few-shot examples " + resource.getDescription(), e);
        }
        return List.copyOf(loaded);
    }

    private static String formatExamples(List<FewShotExample> examples) {
        if (examples.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder("\n\nExamples:\n");
        for (FewShotExample ex : examples) {
            sb.append("\nUser: ").append(ex.user()).append('\n');
            sb.append("Assistant: ").append(ex.assistant().toString()).append('\n');
        }
        return sb.toString();
    }
}
