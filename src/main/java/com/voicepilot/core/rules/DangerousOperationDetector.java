package com.voicepilot.core.rules;

import com.voicepilot.core.safety.SafetyProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scans an utterance for destructive-operation keywords (delete, format, shutdown, ...)
 * in Chinese and English. Matching is case-insensitive.
 * <p>
 * Patterns are compiled once at construction; the detector is safe to share between threads.
 */
@Component
public class DangerousOperationDetector {

    private final List<Pattern> patterns;

    public DangerousOperationDetector(SafetyProperties properties) {
        this.patterns = properties.getDangerousPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    /**
     * @param text the raw utterance
     * @return true if any dangerous pattern occurs in {@code text}; false for null or blank text
     */
    public boolean isDangerous(String text) {
        return firstMatch(text).isPresent();
    }

    /** The keyword that triggered detection, for logging. */
    public Optional<String> firstMatch(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            var matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group());
            }
        }
        return Optional.empty();
    }
}
