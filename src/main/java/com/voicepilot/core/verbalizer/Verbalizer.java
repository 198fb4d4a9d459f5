package com.voicepilot.core.verbalizer;

import com.voicepilot.core.model.ExecutionResult;
import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.IntentSlots;
import com.voicepilot.core.model.Plan;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * User-facing text for confirmations, dry runs and execution results.
 */
@Component
public class Verbalizer {

    static final String SEARCH_URL = "https://www.google.com/search?q=";

    /** The intent's own acknowledgement when it has one, otherwise a default per intent. */
    public String confirmationPrompt(Intent intent) {
        if (!intent.spokenAcknowledgement().isBlank()) {
            return intent.spokenAcknowledgement();
        }
        IntentSlots slots = intent.slots();
        if (slots instanceof IntentSlots.SystemSetting s) {
            return "好的，正在调整" + orDefault(s.setting(), "设置") + "到" + (s.value() != null ? s.value() : "");
        }
        if (slots instanceof IntentSlots.PlayMusic m) {
            return "好的，" + orDefault(m.action(), "播放") + orDefault(m.query(), "音乐");
        }
        if (slots instanceof IntentSlots.WebSearch w) {
            return "好的，帮您搜索" + orDefault(w.query(), "内容");
        }
        if (slots instanceof IntentSlots.WriteNote n) {
            return "好的，正在创建笔记：" + orDefault(n.title(), "笔记");
        }
        if (slots instanceof IntentSlots.ControlApp a) {
            return "好的，" + orDefault(a.action(), "打开") + orDefault(a.app(), "应用");
        }
        if (intent.isClarify()) {
            return "抱歉，我没理解您的意思";
        }
        return "好的，正在执行";
    }

    public String planConfirmationPrompt(Plan plan) {
        String summary = plan.summary().isBlank() ? "" : "（" + plan.summary() + "）";
        return "即将执行" + plan.steps().size() + "个步骤" + summary + "，确认继续吗？";
    }

    /** What the actuator would have done, used in place of execution in dry mode. */
    public String dryRunDescription(Intent intent) {
        IntentSlots slots = intent.slots();
        if (slots instanceof IntentSlots.SystemSetting s) {
            if (s.setting() == null || s.setting().equals("volume")) {
                return "[DRY RUN] Set volume to " + (s.value() != null ? s.value() : 50) + "%";
            }
            return "[DRY RUN] Set " + s.setting() + (s.value() != null ? " to " + s.value() + "%" : "");
        }
        if (slots instanceof IntentSlots.WebSearch w) {
            return "[DRY RUN] Open URL: " + SEARCH_URL + URLEncoder.encode(orDefault(w.query(), ""), StandardCharsets.UTF_8);
        }
        if (slots instanceof IntentSlots.WriteNote n) {
            return "[DRY RUN] Create note: title='" + orDefault(n.title(), "Quick Note")
                    + "', body='" + orDefault(n.body(), "") + "'";
        }
        if (slots instanceof IntentSlots.ControlApp a) {
            String app = orDefault(a.app(), "");
            if ("quit".equals(a.action())) {
                return "[DRY RUN] Quit app: " + app;
            }
            if (a.url() != null && !a.url().isBlank()) {
                return "[DRY RUN] Open URL in " + app + ": " + a.url();
            }
            return "[DRY RUN] Open app: " + app;
        }
        if (slots instanceof IntentSlots.PlayMusic m) {
            return "[DRY RUN] Music action: " + orDefault(m.action(), "play")
                    + (m.query() != null ? " (" + m.query() + ")" : "");
        }
        return "[DRY RUN] Clarify: " + intent.spokenAcknowledgement();
    }

    public String resultMessage(Intent intent, ExecutionResult result) {
        if (!result.succeeded()) {
            String error = result.error().isBlank() ? result.message() : result.error();
            return "抱歉，操作失败了：" + error;
        }
        return switch (intent.name()) {
            case SYSTEM_SETTING -> "设置已完成";
            case PLAY_MUSIC -> "已为您播放";
            case WEB_SEARCH -> "已打开搜索结果";
            case WRITE_NOTE -> "笔记已创建";
            case CONTROL_APP -> "操作已完成";
            case CLARIFY -> "操作成功";
        };
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
