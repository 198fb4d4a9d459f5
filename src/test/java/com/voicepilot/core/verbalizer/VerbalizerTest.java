package com.voicepilot.core.verbalizer;

import com.voicepilot.core.model.ExecutionResult;
import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.IntentSlots;
import com.voicepilot.core.model.Plan;
import com.voicepilot.core.model.Safety;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerbalizerTest {

    private final Verbalizer verbalizer = new Verbalizer();

    private static Intent intent(IntentSlots slots, String ack) {
        return new Intent(slots.intent(), slots, false, ack, Safety.low(""));
    }

    @Nested
    @DisplayName("Confirmation prompts")
    class ConfirmationPrompts {

        @Test
        @DisplayName("acknowledgement is used when present")
        void acknowledgement() {
            assertEquals("好的，把音量调到50%",
                    verbalizer.confirmationPrompt(intent(new IntentSlots.SystemSetting("volume", 50), "好的，把音量调到50%")));
        }

        @Test
        @DisplayName("defaults per intent when the acknowledgement is blank")
        void defaults() {
            assertEquals("好的，帮您搜索java", verbalizer.confirmationPrompt(intent(new IntentSlots.WebSearch("java"), "")));
            assertEquals("好的，正在创建笔记：购物", verbalizer.confirmationPrompt(intent(new IntentSlots.WriteNote("购物", "牛奶"), "")));
            assertEquals("抱歉，我没理解您的意思", verbalizer.confirmationPrompt(intent(new IntentSlots.Clarify(), "")));
        }

        @Test
        @DisplayName("plan prompt states the step count and summary")
        void planPrompt() {
            Plan plan = new Plan(List.of(intent(new IntentSlots.WebSearch("a"), ""), intent(new IntentSlots.WebSearch("b"), "")),
                    "search twice");
            assertEquals("即将执行2个步骤（search twice），确认继续吗？", verbalizer.planConfirmationPrompt(plan));
            assertEquals("即将执行2个步骤，确认继续吗？",
                    verbalizer.planConfirmationPrompt(new Plan(plan.steps(), "")));
        }
    }

    @Nested
    @DisplayName("Dry-run descriptions")
    class DryRunDescriptions {

        @Test
        @DisplayName("volume defaults to fifty percent")
        void volume() {
            assertEquals("[DRY RUN] Set volume to 70%",
                    verbalizer.dryRunDescription(intent(new IntentSlots.SystemSetting("volume", 70), "")));
            assertEquals("[DRY RUN] Set volume to 50%",
                    verbalizer.dryRunDescription(intent(new IntentSlots.SystemSetting("volume", null), "")));
            assertEquals("[DRY RUN] Set mute",
                    verbalizer.dryRunDescription(intent(new IntentSlots.SystemSetting("mute", null), "")));
        }

        @Test
        @DisplayName("search opens an encoded search URL")
        void search() {
            assertEquals("[DRY RUN] Open URL: https://www.google.com/search?q=python+%E6%95%99%E7%A8%8B",
                    verbalizer.dryRunDescription(intent(new IntentSlots.WebSearch("python 教程"), "")));
        }

        @Test
        @DisplayName("notes, apps, music and clarifications")
        void others() {
            assertEquals("[DRY RUN] Create note: title='购物', body='牛奶'",
                    verbalizer.dryRunDescription(intent(new IntentSlots.WriteNote("购物", "牛奶"), "")));
            assertEquals("[DRY RUN] Open app: Safari",
                    verbalizer.dryRunDescription(intent(new IntentSlots.ControlApp("Safari", "open", null), "")));
            assertEquals("[DRY RUN] Quit app: Safari",
                    verbalizer.dryRunDescription(intent(new IntentSlots.ControlApp("Safari", "quit", null), "")));
            assertEquals("[DRY RUN] Open URL in Safari: https://example.com",
                    verbalizer.dryRunDescription(intent(new IntentSlots.ControlApp("Safari", "open", "https://example.com"), "")));
            assertEquals("[DRY RUN] Music action: play (周杰伦)",
                    verbalizer.dryRunDescription(intent(new IntentSlots.PlayMusic("play", "周杰伦"), "")));
            assertEquals("[DRY RUN] Clarify: 请再说一遍",
                    verbalizer.dryRunDescription(intent(new IntentSlots.Clarify(), "请再说一遍")));
        }
    }

    @Nested
    @DisplayName("Result messages")
    class ResultMessages {

        @Test
        @DisplayName("success message per intent")
        void success() {
            ExecutionResult ok = ExecutionResult.success("done", "");
            assertEquals("设置已完成", verbalizer.resultMessage(intent(new IntentSlots.SystemSetting("mute", null), ""), ok));
            assertEquals("已打开搜索结果", verbalizer.resultMessage(intent(new IntentSlots.WebSearch("x"), ""), ok));
            assertEquals("笔记已创建", verbalizer.resultMessage(intent(new IntentSlots.WriteNote("t", "b"), ""), ok));
        }

        @Test
        @DisplayName("failure message carries the error, or the message when there is none")
        void failure() {
            Intent search = intent(new IntentSlots.WebSearch("x"), "");
            assertEquals("抱歉，操作失败了：no browser",
                    verbalizer.resultMessage(search, ExecutionResult.failure("Execution failed", "no browser")));
            assertEquals("抱歉，操作失败了：Execution failed",
                    verbalizer.resultMessage(search, ExecutionResult.failure("Execution failed", "")));
        }
    }
}
