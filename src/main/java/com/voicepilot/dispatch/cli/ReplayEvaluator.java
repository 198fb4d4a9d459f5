package com.voicepilot.dispatch.cli;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient comparison of predicted slots against a replay file's expected slots.
 * <p>
 * Every expected key must be present. Numbers may differ by at most 1. Strings match when
 * either contains the other (case-insensitive); a {@code query} also matches on any shared word.
 * Other value types are not compared.
 */
final class ReplayEvaluator {

    private ReplayEvaluator() {}

    /** @return empty on a match, otherwise the reason for the mismatch */
    static Optional<String> compareSlots(Map<String, Object> predicted, Map<String, Object> expected) {
        if (expected == null || expected.isEmpty()) {
            return Optional.empty();
        }
        for (var entry : expected.entrySet()) {
            String key = entry.getKey();
            Object want = entry.getValue();
            if (!predicted.containsKey(key)) {
                return Optional.of("Missing slot: " + key);
            }
            Object got = predicted.get(key);

            if (want instanceof Number n) {
                Double value = asNumber(got);
                if (value == null) {
                    return Optional.of("Slot " + key + ": type mismatch");
                }
                if (Math.abs(value - n.doubleValue()) > 1) {
                    return Optional.of("Slot " + key + ": value differs too much");
                }
            } else if (want instanceof String w && got instanceof String g) {
                String wl = w.toLowerCase();
                String gl = g.toLowerCase();
                if (!wl.contains(gl) && !gl.contains(wl)) {
                    if (!key.equals("query")) {
                        return Optional.of("Slot " + key + ": value mismatch");
                    }
                    Set<String> shared = new HashSet<>(Arrays.asList(wl.split("\\s+")));
                    shared.retainAll(Arrays.asList(gl.split("\\s+")));
                    if (shared.isEmpty()) {
                        return Optional.of("Slot " + key + ": no word overlap");
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static Double asNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
