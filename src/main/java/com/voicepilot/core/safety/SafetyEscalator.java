package com.voicepilot.core.safety;

import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.Plan;
import com.voicepilot.core.model.ResolvedCommand;
import com.voicepilot.core.model.RiskLevel;
import com.voicepilot.core.model.Safety;
import com.voicepilot.core.rules.DangerousOperationDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Raises the risk of generatively-parsed intents when the source utterance contains
 * dangerous keywords the model under-rated. Risk is only ever raised, never lowered;
 * inputs are not modified.
 */
@Service
public class SafetyEscalator {

    private static final Logger log = LoggerFactory.getLogger(SafetyEscalator.class);

    static final String ESCALATION_REASON = "dangerous keyword detected";

    private final DangerousOperationDetector dangerDetector;
    private final SafetyProperties properties;

    public SafetyEscalator(DangerousOperationDetector dangerDetector, SafetyProperties properties) {
        this.dangerDetector = dangerDetector;
        this.properties = properties;
    }

    /**
     * Escalates a single intent. Only {@code low} risk is changed; medium and high pass through.
     *
     * @param intent     the parsed intent
     * @param sourceText the utterance it was parsed from
     * @return {@code intent} itself when nothing changes, otherwise an escalated copy
     */
    public Intent escalate(Intent intent, String sourceText) {
        if (intent.safety().risk() != RiskLevel.LOW) {
            return intent;
        }
        var keyword = dangerDetector.firstMatch(sourceText);
        if (keyword.isEmpty()) {
            return intent;
        }
        log.warn("Escalating {} to high risk, keyword '{}'", intent.name().wireName(), keyword.get());
        Intent escalated = intent.withSafety(Safety.high(ESCALATION_REASON));
        if (properties.isConfirmDangerous()) {
            escalated = escalated.withRequiresConfirmation(true);
        }
        return escalated;
    }

    /** Escalates an intent, or every step of a plan against the whole utterance. */
    public ResolvedCommand escalate(ResolvedCommand command, String sourceText) {
        if (command instanceof Plan plan) {
            return plan.mapSteps(step -> escalate(step, sourceText));
        }
        return escalate((Intent) command, sourceText);
    }

    /** True if {@code escalate} would change at least one step of {@code command}. */
    public boolean wouldEscalate(ResolvedCommand command, String sourceText) {
        return command.steps().stream().anyMatch(s -> s.safety().risk() == RiskLevel.LOW)
                && dangerDetector.isDangerous(sourceText);
    }
}
