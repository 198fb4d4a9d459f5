package com.voicepilot.core.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.IntentName;
import com.voicepilot.core.model.IntentSlots;
import com.voicepilot.core.model.Plan;
import com.voicepilot.core.model.ResolvedCommand;
import com.voicepilot.core.model.RiskLevel;
import com.voicepilot.core.model.Safety;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates raw JSON payloads into {@link Intent} / {@link Plan} and renders them back.
 * <p>
 * Intent payload: {@code {"intent", "slots", "confirm", "speak_back", "safety": {"risk", "reason"}}}.
 * Plan payload: {@code {"steps": [intent...], "summary"}}. The aliases {@code name},
 * {@code requires_confirmation}, {@code spoken_acknowledgement} and {@code plan} are accepted
 * on input. Missing optional fields take their defaults; an unknown intent name or risk level
 * is a violation.
 */
@Component
public class CommandSchema {

    private static final TypeReference<Map<String, Object>> RAW_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CommandSchema(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Validates either shape. A payload with a {@code steps} (or {@code plan}) member is a plan.
     *
     * @throws CommandValidationException listing every violation
     */
    public ResolvedCommand validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new CommandValidationException(List.of("payload must be a JSON object"));
        }
        if (payload.has("steps") || payload.has("plan")) {
            return validatePlan(payload);
        }
        return validateIntent(payload);
    }

    public Intent validateIntent(JsonNode payload) {
        var errors = new ArrayList<String>();
        Intent intent = readIntent(payload, "", errors);
        if (!errors.isEmpty()) {
            throw new CommandValidationException(errors);
        }
        return intent;
    }

    public Plan validatePlan(JsonNode payload) {
        var errors = new ArrayList<String>();
        JsonNode stepsNode = payload.has("steps") ? payload.get("steps") : payload.get("plan");
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new CommandValidationException(List.of("steps must be an array"));
        }
        if (stepsNode.isEmpty()) {
            throw new CommandValidationException(List.of("steps must not be empty"));
        }
        var steps = new ArrayList<Intent>();
        for (int i = 0; i < stepsNode.size(); i++) {
            Intent step = readIntent(stepsNode.get(i), "steps[" + i + "].", errors);
            if (step != null) {
                steps.add(step);
            }
        }
        String summary = textOrDefault(payload.get("summary"), "summary", "", errors);
        if (!errors.isEmpty()) {
            throw new CommandValidationException(errors);
        }
        return new Plan(steps, summary);
    }

    /** Renders a command in the canonical wire shape. */
    public ObjectNode toPayload(ResolvedCommand command) {
        if (command instanceof Plan plan) {
            ObjectNode node = objectMapper.createObjectNode();
            ArrayNode steps = node.putArray("steps");
            for (Intent step : plan.steps()) {
                steps.add(intentPayload(step));
            }
            node.put("summary", plan.summary());
            return node;
        }
        return intentPayload((Intent) command);
    }

    private ObjectNode intentPayload(Intent intent) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("intent", intent.name().wireName());
        node.set("slots", objectMapper.valueToTree(intent.slots().toMap()));
        node.put("confirm", intent.requiresConfirmation());
        node.put("speak_back", intent.spokenAcknowledgement());
        ObjectNode safety = node.putObject("safety");
        safety.put("risk", intent.safety().risk().wireName());
        safety.put("reason", intent.safety().reason());
        return node;
    }

    private Intent readIntent(JsonNode node, String path, List<String> errors) {
        if (node == null || !node.isObject()) {
            errors.add(pathOr(path, "intent payload") + " must be a JSON object");
            return null;
        }
        int errorsBefore = errors.size();

        JsonNode nameNode = first(node, "intent", "name");
        IntentName name = null;
        if (nameNode == null || !nameNode.isTextual()) {
            errors.add(path + "intent is required");
        } else {
            name = IntentName.fromWire(nameNode.asText()).orElse(null);
            if (name == null) {
                errors.add(path + "intent '" + nameNode.asText() + "' is not a known intent");
            }
        }

        Map<String, Object> rawSlots = null;
        JsonNode slotsNode = node.get("slots");
        if (slotsNode != null && !slotsNode.isNull()) {
            if (slotsNode.isObject()) {
                rawSlots = objectMapper.convertValue(slotsNode, RAW_MAP);
            } else {
                errors.add(path + "slots must be an object");
            }
        }

        boolean confirm = false;
        JsonNode confirmNode = first(node, "confirm", "requires_confirmation");
        if (confirmNode != null && !confirmNode.isNull()) {
            if (confirmNode.isBoolean()) {
                confirm = confirmNode.booleanValue();
            } else {
                errors.add(path + "confirm must be a boolean");
            }
        }

        String ack = textOrDefault(first(node, "speak_back", "spoken_acknowledgement"),
                path + "speak_back", "", errors);

        Safety safety = readSafety(node.get("safety"), path, errors);

        IntentSlots slots = null;
        if (name != null) {
            slots = SlotCodec.decode(name, rawSlots, path + "slots", errors);
        }

        if (errors.size() > errorsBefore) {
            return null;
        }
        return new Intent(name, slots, confirm, ack, safety);
    }

    private Safety readSafety(JsonNode node, String path, List<String> errors) {
        if (node == null || node.isNull()) {
            return Safety.low("");
        }
        if (!node.isObject()) {
            errors.add(path + "safety must be an object");
            return null;
        }
        RiskLevel risk = RiskLevel.LOW;
        JsonNode riskNode = node.get("risk");
        if (riskNode != null && !riskNode.isNull()) {
            risk = riskNode.isTextual() ? RiskLevel.fromWire(riskNode.asText()).orElse(null) : null;
            if (risk == null) {
                errors.add(path + "safety.risk must be one of low, medium, high");
                return null;
            }
        }
        String reason = textOrDefault(node.get("reason"), path + "safety.reason", "", errors);
        return new Safety(risk, reason);
    }

    private static String textOrDefault(JsonNode node, String field, String fallback, List<String> errors) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isTextual()) {
            errors.add(field + " must be a string");
            return fallback;
        }
        return node.asText();
    }

    private static JsonNode first(JsonNode node, String primary, String alias) {
        JsonNode value = node.get(primary);
        return value != null ? value : node.get(alias);
    }

    private static String pathOr(String path, String fallback) {
        return path.isEmpty() ? fallback : path.substring(0, path.length() - 1);
    }
}
