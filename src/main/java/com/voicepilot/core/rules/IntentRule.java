package com.voicepilot.core.rules;

import com.voicepilot.core.model.IntentName;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of the ordered rule table: an intent and the regular expressions that select it.
 * Bound from {@code voicepilot.rules.intent-rules}.
 */
public class IntentRule {

    private IntentName intent;
    private List<String> patterns = new ArrayList<>();

    public IntentRule() {}

    public IntentRule(IntentName intent, List<String> patterns) {
        this.intent = intent;
        this.patterns = new ArrayList<>(patterns);
    }

    public IntentName getIntent() {
        return intent;
    }

    public void setIntent(IntentName intent) {
        this.intent = intent;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns;
    }
}
