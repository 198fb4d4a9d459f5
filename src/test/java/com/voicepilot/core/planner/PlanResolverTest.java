package com.voicepilot.core.planner;

import com.voicepilot.core.events.EventBus;
import com.voicepilot.core.events.EventType;
import com.voicepilot.core.events.VoicePilotEvent;
import com.voicepilot.core.llm.FailureKind;
import com.voicepilot.core.llm.GenerationResult;
import com.voicepilot.core.llm.GenerativeParser;
import com.voicepilot.core.llm.LlmProperties;
import com.voicepilot.core.logging.MdcContext;
import com.voicepilot.core.metrics.VoicePilotMetrics;
import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.IntentName;
import com.voicepilot.core.model.IntentSlots;
import com.voicepilot.core.model.Plan;
import com.voicepilot.core.model.RiskLevel;
import com.voicepilot.core.model.Safety;
import com.voicepilot.core.rules.DangerousOperationDetector;
import com.voicepilot.core.rules.RuleMatcher;
import com.voicepilot.core.rules.RuleProperties;
import com.voicepilot.core.safety.SafetyEscalator;
import com.voicepilot.core.safety.SafetyProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PlanResolver}.
 * <p>
 * Rules, splitting and escalation are real; the generative parser is mocked.
 */
class PlanResolverTest {

    private GenerativeParser generativeParser;
    private LlmProperties llmProperties;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private PlanResolver resolver;

    @BeforeEach
    void setUp() {
        var safetyProperties = new SafetyProperties();
        var detector = new DangerousOperationDetector(safetyProperties);
        var ruleProperties = new RuleProperties();
        generativeParser = mock(GenerativeParser.class);
        llmProperties = new LlmProperties();
        llmProperties.setEnabled(false);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        resolver = new PlanResolver(generativeParser, new RuleMatcher(ruleProperties, detector),
                new MultiStepSplitter(ruleProperties), detector, new SafetyEscalator(detector, safetyProperties),
                llmProperties, eventBus, new VoicePilotMetrics(registry));
    }

    private static Intent lowRiskNote() {
        return new Intent(IntentName.WRITE_NOTE, new IntentSlots.WriteNote("todo", "clean files"), false, "",
                Safety.low(""));
    }

    @Nested
    @DisplayName("Rule-based resolution")
    class RuleBased {

        @Test
        @DisplayName("two tasks joined by a connective become a plan")
        void splitPlan() {
            Resolution resolution = resolver.resolve("打开Safari然后搜索Python教程", false);

            assertEquals(Resolution.Source.SPLIT, resolution.source());
            Plan plan = assertInstanceOf(Plan.class, resolution.command());
            assertEquals("execute 2 tasks", plan.summary());
            assertEquals(new IntentSlots.ControlApp("Safari", "open", null), plan.steps().get(0).slots());
            assertEquals(new IntentSlots.WebSearch("Python教程"), plan.steps().get(1).slots());
        }

        @Test
        @DisplayName("dangerous text is never split")
        void dangerousNotSplit() {
            Resolution resolution = resolver.resolve("打开终端然后删除所有文件", false);

            assertEquals(Resolution.Source.RULES, resolution.source());
            Intent intent = assertInstanceOf(Intent.class, resolution.command());
            assertTrue(intent.isClarify());
            assertEquals(RiskLevel.HIGH, intent.safety().risk());
        }

        @Test
        @DisplayName("single task resolves to an intent")
        void singleTask() {
            Resolution resolution = resolver.resolve("把音量调到50%", false);

            assertEquals(Resolution.Source.RULES, resolution.source());
            assertEquals(IntentName.SYSTEM_SETTING, ((Intent) resolution.command()).name());
            assertNull(resolution.generativeFailure());
        }

        @Test
        @DisplayName("clarifying fragments are dropped and one usable fragment falls back to the whole text")
        void singleUsableFragment() {
            Resolution resolution = resolver.resolve("打开微信，今天天气怎么样", false);

            assertEquals(Resolution.Source.RULES, resolution.source());
            assertEquals(IntentName.CONTROL_APP, ((Intent) resolution.command()).name());
        }

        @Test
        @DisplayName("resolve without a flag honours voicepilot.llm.enabled")
        void disabledGenerative() {
            resolver.resolve("把音量调到50%");
            verifyNoInteractions(generativeParser);
        }

        @Test
        @DisplayName("resolvePlanOrIntent returns the command")
        void resolvePlanOrIntent() {
            assertTrue(resolver.resolvePlanOrIntent("打开Safari然后搜索Python教程").isPlan());
        }
    }

    @Nested
    @DisplayName("Generative resolution")
    class Generative {

        @Test
        @DisplayName("successful parse is used as is for harmless text")
        void success() {
            Intent parsed = lowRiskNote();
            when(generativeParser.parse(anyString())).thenReturn(new GenerationResult.Success(parsed, 1));

            Resolution resolution = resolver.resolve("记录待办事项", true);

            assertEquals(Resolution.Source.GENERATIVE, resolution.source());
            assertEquals(parsed, resolution.command());
        }

        @Test
        @DisplayName("successful parse of dangerous text is escalated")
        void escalated() {
            when(generativeParser.parse(anyString())).thenReturn(new GenerationResult.Success(lowRiskNote(), 1));

            Resolution resolution = resolver.resolve("删除所有文件", true);

            Intent intent = (Intent) resolution.command();
            assertEquals(Resolution.Source.GENERATIVE, resolution.source());
            assertEquals(RiskLevel.HIGH, intent.safety().risk());
            assertTrue(intent.requiresConfirmation());
            assertEquals(1.0, registry.get("voicepilot.safety.escalations").counter().count());
        }

        @Test
        @DisplayName("failure falls back to rules and keeps the failure")
        void failureFallsBack() {
            when(generativeParser.parse(anyString()))
                    .thenReturn(new GenerationResult.Failure(FailureKind.TIMEOUT, "too slow"));

            Resolution resolution = resolver.resolve("把音量调到50%", true);

            assertEquals(Resolution.Source.RULES, resolution.source());
            assertEquals(FailureKind.TIMEOUT, resolution.generativeFailure().kind());
            assertEquals(IntentName.SYSTEM_SETTING, ((Intent) resolution.command()).name());
        }

        @Test
        @DisplayName("an unexpected parser exception is treated as a service error")
        void parserThrows() {
            when(generativeParser.parse(anyString())).thenThrow(new IllegalStateException("boom"));

            Resolution resolution = resolver.resolve("打开Safari然后搜索Python教程", true);

            assertEquals(FailureKind.SERVICE_ERROR, resolution.generativeFailure().kind());
            assertEquals(Resolution.Source.SPLIT, resolution.source());
        }
    }

    @Test
    @DisplayName("resolution publishes utterance.resolved with the utterance id")
    void publishesEvent() {
        List<VoicePilotEvent> events = new ArrayList<>();
        eventBus.subscribeAll(events::add);

        Resolution resolution = resolver.resolve("打开Safari然后搜索Python教程", false);

        assertEquals(1, events.size());
        assertEquals(EventType.UTTERANCE_RESOLVED, events.get(0).eventType());
        assertEquals(resolution.utteranceId(), events.get(0).utteranceId());
        assertEquals(2, events.get(0).payload().get("steps"));
        assertEquals(List.of("control_app", "web_search"), events.get(0).payload().get("intents"));
    }

    @Test
    @DisplayName("utterance ids are unique and MDC is cleared afterwards")
    void utteranceIds() {
        String first = resolver.resolve("静音", false).utteranceId();
        String second = resolver.resolve("静音", false).utteranceId();

        assertTrue(first.matches("UTT-\\d{4}-\\d{4,}"), first);
        assertNotEquals(first, second);
        assertNull(MDC.get(MdcContext.UTTERANCE_ID));
    }

    @Test
    @DisplayName("resolution counter is tagged by source")
    void resolutionMetric() {
        resolver.resolve("打开Safari然后搜索Python教程", false);
        resolver.resolve("静音", false);

        assertEquals(1.0, registry.get("voicepilot.resolutions.total").tag("source", "split").counter().count());
        assertEquals(1.0, registry.get("voicepilot.resolutions.total").tag("source", "rules").counter().count());
    }
}
