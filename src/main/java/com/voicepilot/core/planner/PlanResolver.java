package com.voicepilot.core.planner;

import com.voicepilot.core.events.EventBus;
import com.voicepilot.core.events.EventType;
import com.voicepilot.core.llm.GenerationResult;
import com.voicepilot.core.llm.GenerativeParser;
import com.voicepilot.core.llm.FailureKind;
import com.voicepilot.core.llm.LlmProperties;
import com.voicepilot.core.logging.MdcContext;
import com.voicepilot.core.metrics.VoicePilotMetrics;
import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.Plan;
import com.voicepilot.core.model.ResolvedCommand;
import com.voicepilot.core.rules.DangerousOperationDetector;
import com.voicepilot.core.rules.RuleMatcher;
import com.voicepilot.core.safety.SafetyEscalator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for turning an utterance into an {@link Intent} or a {@link Plan}.
 * <p>
 * Strategy order:
 * <ol>
 *   <li>generative parsing (when enabled), followed by safety escalation</li>
 *   <li>dangerous utterances go to the rule matcher whole, never split</li>
 *   <li>multi-step heuristics: split, rule-match each fragment, drop clarifications;
 *       two or more intents become a plan</li>
 *   <li>a single rule match on the whole text</li>
 * </ol>
 * Resolution never fails: the worst case is a {@code clarify} intent.
 */
@Service
public class PlanResolver {

    private static final Logger log = LoggerFactory.getLogger(PlanResolver.class);
    private static final AtomicInteger UTTERANCE_COUNTER = new AtomicInteger(0);

    private final GenerativeParser generativeParser;
    private final RuleMatcher ruleMatcher;
    private final MultiStepSplitter splitter;
    private final DangerousOperationDetector dangerDetector;
    private final SafetyEscalator safetyEscalator;
    private final LlmProperties llmProperties;
    private final EventBus eventBus;
    private final VoicePilotMetrics metrics;

    public PlanResolver(GenerativeParser generativeParser, RuleMatcher ruleMatcher,
                        MultiStepSplitter splitter, DangerousOperationDetector dangerDetector,
                        SafetyEscalator safetyEscalator, LlmProperties llmProperties,
                        EventBus eventBus, VoicePilotMetrics metrics) {
        this.generativeParser = generativeParser;
        this.ruleMatcher = ruleMatcher;
        this.splitter = splitter;
        this.dangerDetector = dangerDetector;
        this.safetyEscalator = safetyEscalator;
        this.llmProperties = llmProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /** Resolves {@code text} to the command only. */
    public ResolvedCommand resolvePlanOrIntent(String text) {
        return resolve(text).command();
    }

    /** Resolves using generative parsing when {@code voicepilot.llm.enabled} is true. */
    public Resolution resolve(String text) {
        return resolve(text, llmProperties.isEnabled());
    }

    /**
     * @param text          the utterance
     * @param useGenerative whether to try the generative parser first
     */
    public Resolution resolve(String text, boolean useGenerative) {
        String utteranceId = generateUtteranceId();
        String utterance = text != null ? text.trim() : "";
        MdcContext.setUtterance(utteranceId);
        try {
            log.info("Resolving utterance {}: {}", utteranceId, utterance);
            Resolution resolution = doResolve(utteranceId, utterance, useGenerative);

            metrics.recordResolution(resolution.source().name().toLowerCase());
            eventBus.publish(EventType.UTTERANCE_RESOLVED, utteranceId, null,
                    Map.of("source", resolution.source().name(),
                            "steps", resolution.command().steps().size(),
                            "intents", resolution.command().steps().stream()
                                    .map(s -> s.name().wireName()).toList()));
            log.info("Utterance {} resolved via {} to {} step(s)", utteranceId,
                    resolution.source(), resolution.command().steps().size());
            return resolution;
        } finally {
            MdcContext.clear();
        }
    }

    private Resolution doResolve(String utteranceId, String text, boolean useGenerative) {
        GenerationResult.Failure failure = null;
        if (useGenerative) {
            GenerationResult result = parseGeneratively(text);
            if (result instanceof GenerationResult.Success success) {
                ResolvedCommand command = success.command();
                if (safetyEscalator.wouldEscalate(command, text)) {
                    metrics.incrementEscalations();
                }
                return new Resolution(utteranceId, text, safetyEscalator.escalate(command, text),
                        Resolution.Source.GENERATIVE, null);
            }
            failure = (GenerationResult.Failure) result;
            log.warn("Generative parsing failed ({}), falling back to rules", failure.kind());
        }

        if (dangerDetector.isDangerous(text)) {
            return new Resolution(utteranceId, text, ruleMatcher.match(text), Resolution.Source.RULES, failure);
        }

        if (splitter.looksMultiStep(text)) {
            List<Intent> steps = splitter.split(text).stream()
                    .map(ruleMatcher::match)
                    .filter(intent -> !intent.isClarify())
                    .toList();
            if (steps.size() >= 2) {
                log.info("Split utterance into {} tasks", steps.size());
                return new Resolution(utteranceId, text, new Plan(steps, "execute " + steps.size() + " tasks"),
                        Resolution.Source.SPLIT, failure);
            }
            log.debug("Split yielded {} usable intent(s), matching whole text", steps.size());
        }

        return new Resolution(utteranceId, text, ruleMatcher.match(text), Resolution.Source.RULES, failure);
    }

    private GenerationResult parseGeneratively(String text) {
        try {
            return generativeParser.parse(text);
        } catch (RuntimeException e) {
            log.error("Generative parser failed unexpectedly: {}", e.getMessage(), e);
            return new GenerationResult.Failure(FailureKind.SERVICE_ERROR, e.getMessage());
        }
    }

    /**
     * Generates a unique utterance ID in the format UTT-YYYY-NNNN.
     */
    public String generateUtteranceId() {
        int count = UTTERANCE_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("UTT-%d-%04d", year, count);
    }
}
