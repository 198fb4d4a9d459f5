package com.voicepilot.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of free-form model output.
 * <p>
 * Markdown fence lines are dropped, then the widest span from the first {@code {} to the
 * last {@code }} is parsed. Prose before or after the object is ignored.
 */
@Component
public class JsonPayloadExtractor {

    private static final Pattern FENCE_LINE = Pattern.compile("(?m)^\\s*```[\\w-]*\\s*$\\R?");

    private final ObjectMapper objectMapper;

    public JsonPayloadExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws LlmParseException if there is no brace span or it is not a JSON object
     */
    public JsonNode extract(String raw) {
        if (raw == null) {
            throw new LlmParseException("no output to parse");
        }
        String text = FENCE_LINE.matcher(raw.strip()).replaceAll("");
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new LlmParseException("no JSON object found in output");
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            if (!node.isObject()) {
                throw new LlmParseException("output is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new LlmParseException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
    }
}
