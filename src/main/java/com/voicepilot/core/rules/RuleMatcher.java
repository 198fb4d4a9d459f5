package com.voicepilot.core.rules;

import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.IntentName;
import com.voicepilot.core.model.IntentSlots;
import com.voicepilot.core.model.Safety;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Deterministic keyword/pattern classifier used whenever generative parsing is
 * unavailable or fails.
 * <p>
 * Classification order:
 * <ol>
 *   <li>dangerous-operation keywords: {@code clarify}, high risk, confirmation required</li>
 *   <li>the ordered intent rule table: first intent with a matching pattern wins, slots are extracted</li>
 *   <li>no match: {@code clarify}, low risk, confirmation required</li>
 * </ol>
 * The same text always yields the same intent.
 */
@Component
public class RuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(RuleMatcher.class);

    static final String DANGEROUS_REASON = "dangerous operation detected";
    static final String NO_MATCH_REASON = "no matching intent";
    static final String NO_MATCH_ACKNOWLEDGEMENT = "抱歉，我不太理解您的意思，能具体说说吗？";

    private record CompiledRule(IntentName intent, List<Pattern> patterns) {

        boolean matches(String text) {
            return patterns.stream().anyMatch(p -> p.matcher(text).find());
        }
    }

    private final List<CompiledRule> rules;
    private final DangerousOperationDetector dangerDetector;

    public RuleMatcher(RuleProperties properties, DangerousOperationDetector dangerDetector) {
        this.dangerDetector = dangerDetector;
        this.rules = properties.getIntentRules().stream()
                .map(RuleMatcher::compile)
                .toList();
        log.info("Rule matcher ready with {} intent rules", rules.size());
    }

    private static CompiledRule compile(IntentRule rule) {
        if (rule.getIntent() == null) {
            throw new IllegalArgumentException("intent rule without an intent name");
        }
        if (rule.getIntent() == IntentName.CLARIFY) {
            throw new IllegalArgumentException("clarify cannot be the target of an intent rule");
        }
        List<Pattern> compiled = rule.getPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
        return new CompiledRule(rule.getIntent(), compiled);
    }

    /**
     * Classifies {@code text}. Total: every input, including blank text, yields an intent.
     */
    public Intent match(String text) {
        String utterance = text != null ? text.trim() : "";

        if (dangerDetector.isDangerous(utterance)) {
            log.info("Dangerous operation in '{}', asking for clarification", utterance);
            return Intent.clarify("您确定要执行「" + utterance + "」吗？这可能有风险。",
                    Safety.high(DANGEROUS_REASON));
        }

        for (CompiledRule rule : rules) {
            if (rule.matches(utterance)) {
                IntentSlots slots = SlotExtractor.extract(rule.intent(), utterance);
                log.debug("Rule matched {} for '{}'", rule.intent().wireName(), utterance);
                return new Intent(rule.intent(), slots, false,
                        "好的，" + acknowledgement(slots), Safety.low(""));
            }
        }

        log.debug("No rule matched '{}'", utterance);
        return Intent.clarify(NO_MATCH_ACKNOWLEDGEMENT, Safety.low(NO_MATCH_REASON));
    }

    private static String acknowledgement(IntentSlots slots) {
        if (slots instanceof IntentSlots.SystemSetting s) {
            String label = switch (s.setting()) {
                case "brightness" -> "亮度";
                case "mute" -> "静音";
                case "screenshot" -> "截图";
                default -> "音量";
            };
            if (s.value() != null) {
                return "把" + label + "调到" + s.value() + "%";
            }
            return s.setting().equals("mute") || s.setting().equals("screenshot") ? label : "调节" + label;
        }
        if (slots instanceof IntentSlots.PlayMusic m) {
            return switch (m.action()) {
                case "pause" -> "暂停播放";
                case "next" -> "播放下一首";
                case "previous" -> "播放上一首";
                default -> "播放" + (m.query() != null ? m.query() : "音乐");
            };
        }
        if (slots instanceof IntentSlots.WebSearch w) {
            return "搜索" + w.query();
        }
        if (slots instanceof IntentSlots.WriteNote) {
            return "创建笔记";
        }
        if (slots instanceof IntentSlots.ControlApp a) {
            return ("quit".equals(a.action()) ? "退出" : "打开") + (a.app() != null ? a.app() : "应用");
        }
        return "执行操作";
    }
}
