package com.voicepilot.core.schema;

import com.voicepilot.core.model.IntentName;
import com.voicepilot.core.model.IntentSlots;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Decodes the raw string-keyed slot map of a payload into the typed slot shape
 * selected by the intent name. Unknown keys are ignored.
 */
public final class SlotCodec {

    private SlotCodec() {} // utility class

    /**
     * @param name   the intent the slots belong to
     * @param raw    raw slot map (scalar values), may be null
     * @param path   prefix for error messages, e.g. {@code "steps[0].slots"}
     * @param errors receives one entry per violation
     * @return the typed slots; meaningful only when no error was added
     */
    public static IntentSlots decode(IntentName name, Map<String, Object> raw, String path, List<String> errors) {
        Map<String, Object> slots = raw != null ? raw : Map.of();
        for (var entry : slots.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map || value instanceof List) {
                errors.add(path + "." + entry.getKey() + " must be a scalar");
            }
        }
        return switch (name) {
            case SYSTEM_SETTING -> new IntentSlots.SystemSetting(
                    text(slots, "setting", path, errors),
                    integer(slots, "value", path, errors));
            case PLAY_MUSIC -> new IntentSlots.PlayMusic(
                    text(slots, "action", path, errors),
                    text(slots, "query", path, errors));
            case WEB_SEARCH -> new IntentSlots.WebSearch(
                    text(slots, "query", path, errors));
            case WRITE_NOTE -> new IntentSlots.WriteNote(
                    text(slots, "title", path, errors),
                    text(slots, "body", path, errors));
            case CONTROL_APP -> new IntentSlots.ControlApp(
                    text(slots, "app", path, errors),
                    text(slots, "action", path, errors),
                    text(slots, "url", path, errors));
            case CLARIFY -> new IntentSlots.Clarify();
        };
    }

    private static String text(Map<String, Object> slots, String key, String path, List<String> errors) {
        Object value = slots.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        errors.add(path + "." + key + " must be a string");
        return null;
    }

    private static Integer integer(Map<String, Object> slots, String key, String path, List<String> errors) {
        Object value = slots.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            try {
                return new BigDecimal(n.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                errors.add(path + "." + key + " must be a whole number within int range, got " + n);
                return null;
            }
        }
        if (value instanceof String s) {
            String digits = s.trim();
            if (digits.endsWith("%")) {
                digits = digits.substring(0, digits.length() - 1).trim();
            }
            try {
                return Integer.parseInt(digits);
            } catch (NumberFormatException e) {
                errors.add(path + "." + key + " must be an integer, got '" + s + "'");
                return null;
            }
        }
        errors.add(path + "." + key + " must be an integer");
        return null;
    }
}
