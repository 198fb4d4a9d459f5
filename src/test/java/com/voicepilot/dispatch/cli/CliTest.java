package com.voicepilot.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicepilot.core.events.EventBus;
import com.voicepilot.core.execution.Actuator;
import com.voicepilot.core.execution.ExecutionProperties;
import com.voicepilot.core.execution.StepSequencer;
import com.voicepilot.core.llm.GenerativeParser;
import com.voicepilot.core.llm.LlmProperties;
import com.voicepilot.core.metrics.VoicePilotMetrics;
import com.voicepilot.core.model.ExecutionResult;
import com.voicepilot.core.model.IntentName;
import com.voicepilot.core.planner.MultiStepSplitter;
import com.voicepilot.core.planner.PlanResolver;
import com.voicepilot.core.rules.DangerousOperationDetector;
import com.voicepilot.core.rules.RuleMatcher;
import com.voicepilot.core.rules.RuleProperties;
import com.voicepilot.core.safety.SafetyEscalator;
import com.voicepilot.core.safety.SafetyProperties;
import com.voicepilot.core.schema.CommandSchema;
import com.voicepilot.core.verbalizer.Verbalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the VoicePilot CLI command structure.
 * These tests exercise picocli directly without Spring context, with the rule-based
 * resolution path wired from real components and the generative parser disabled.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PlanResolver planResolver;
    private StepSequencer sequencer;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        var safetyProperties = new SafetyProperties();
        var detector = new DangerousOperationDetector(safetyProperties);
        var ruleProperties = new RuleProperties();
        var llmProperties = new LlmProperties();
        llmProperties.setEnabled(false);
        var metrics = new VoicePilotMetrics(new SimpleMeterRegistry());
        eventBus = new EventBus();
        planResolver = new PlanResolver(mock(GenerativeParser.class), new RuleMatcher(ruleProperties, detector),
                new MultiStepSplitter(ruleProperties), detector, new SafetyEscalator(detector, safetyProperties),
                llmProperties, eventBus, metrics);
        sequencer = new StepSequencer(new Verbalizer(), new ExecutionProperties(), eventBus, metrics);
    }

    @AfterEach
    void tearDown() {
        sequencer.shutdown();
    }

    /**
     * Custom picocli IFactory that provides real or mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory(Actuator actuator) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ResolveCommand.class) {
                    return (K) new ResolveCommand(planResolver, new CommandSchema(objectMapper), objectMapper);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(planResolver, sequencer, new Verbalizer(), eventBus,
                            Optional.ofNullable(actuator));
                }
                if (cls == ReplayCommand.class) {
                    return (K) new ReplayCommand(planResolver, objectMapper);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(null, args);
    }

    private CliResult execute(Actuator actuator, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true, StandardCharsets.UTF_8);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new VoicePilotCommand(), createFactory(actuator));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static String fixture(String name) throws Exception {
        return Path.of(CliTest.class.getResource("/replay/" + name).toURI()).toString();
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("resolve"), "Help should list 'resolve' subcommand");
            assertTrue(output.contains("run"), "Help should list 'run' subcommand");
            assertTrue(output.contains("replay"), "Help should list 'replay' subcommand");
            assertTrue(output.contains("help"), "Help should list 'help' subcommand");
        }

        @Test
        @DisplayName("--help includes description")
        void helpIncludesDescription() {
            CliResult result = execute("--help");
            assertTrue(result.output().contains("confirmation-gated commands"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("VoicePilot 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("VOICEPILOT v0.1.0"));
            assertTrue(result.output().contains("Usage:"));
        }

        @Test
        @DisplayName("resolve without an utterance is a usage error")
        void resolveNeedsUtterance() {
            assertNotEquals(0, execute("resolve").exitCode());
        }
    }

    @Nested
    @DisplayName("Resolve command")
    class ResolveTests {

        @Test
        @DisplayName("prints the resolved intent as JSON")
        void resolveIntent() {
            CliResult result = execute("resolve", "--no-llm", "把音量调到50%");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("resolved via RULES"));
            assertTrue(result.output().contains("\"intent\" : \"system_setting\""), result.output());
            assertTrue(result.output().contains("\"value\" : 50"));
        }

        @Test
        @DisplayName("prints a plan with its steps")
        void resolvePlan() {
            CliResult result = execute("resolve", "--no-llm", "打开Safari然后搜索Python教程");

            assertTrue(result.output().contains("resolved via SPLIT"));
            assertTrue(result.output().contains("\"steps\""));
            assertTrue(result.output().contains("\"summary\" : \"execute 2 tasks\""));
        }

        @Test
        @DisplayName("dangerous text resolves to a high risk clarification")
        void resolveDangerous() {
            CliResult result = execute("resolve", "删除所有文件");

            assertTrue(result.output().contains("\"intent\" : \"clarify\""));
            assertTrue(result.output().contains("\"risk\" : \"high\""));
        }
    }

    @Nested
    @DisplayName("Run command")
    class RunTests {

        @Test
        @DisplayName("--dry-run describes every step without an actuator")
        void dryRun() {
            Actuator actuator = mock(Actuator.class);

            CliResult result = execute(actuator, "run", "--dry-run", "--no-llm", "打开Safari然后搜索Python教程");

            assertEquals(0, result.exitCode());
            verifyNoInteractions(actuator);
            assertTrue(result.output().contains("[DRY RUN] Open app: Safari"));
            assertTrue(result.output().contains("[DRY RUN] Open URL: https://www.google.com/search?q=Python"));
            assertTrue(result.output().contains("completed 2 of 2 steps"));
        }

        @Test
        @DisplayName("without an actuator the run falls back to a dry run")
        void noActuator() {
            CliResult result = execute("run", "--no-llm", "静音");

            assertTrue(result.output().contains("No actuator configured"));
            assertTrue(result.output().contains("[DRY RUN] Set mute"));
        }

        @Test
        @DisplayName("--yes executes through the actuator and reports the result")
        void executesThroughActuator() {
            Actuator actuator = mock(Actuator.class);
            when(actuator.execute(any())).thenReturn(ExecutionResult.success("Volume set", ""));

            CliResult result = execute(actuator, "run", "--yes", "--no-llm", "把音量调到50%");

            verify(actuator).execute(argThat(intent -> intent.name() == IntentName.SYSTEM_SETTING));
            assertTrue(result.output().contains("设置已完成"));
            assertTrue(result.output().contains("completed 1 of 1 step"));
        }

        @Test
        @DisplayName("a failing step is reported as an error")
        void failure() {
            Actuator actuator = mock(Actuator.class);
            when(actuator.execute(any())).thenReturn(ExecutionResult.failure("Execution failed", "no audio device"));

            CliResult result = execute(actuator, "run", "-y", "--no-llm", "把音量调到50%");

            assertTrue(result.output().contains("抱歉，操作失败了：no audio device"));
            assertTrue(result.output().contains("step 1 (system_setting) failed: no audio device"));
        }
    }

    @Nested
    @DisplayName("Replay command")
    class ReplayTests {

        @Test
        @DisplayName("labelled fixture passes completely")
        void allPass() throws Exception {
            CliResult result = execute("replay", fixture("tasks.csv"));

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Intent accuracy:  6/6 (100.0%)"), result.output());
            assertTrue(result.output().contains("Overall accuracy: 6/6 (100.0%)"));
            assertTrue(result.output().contains("All cases passed."));
        }

        @Test
        @DisplayName("mismatches are listed")
        void mismatches() throws Exception {
            Path csv = tempDir.resolve("cases.csv");
            Files.writeString(csv, String.join("\n",
                    "utterance,expected_intent,expected_slots",
                    "今天天气怎么样,web_search,",
                    "把音量调到50%,system_setting,\"{\"\"value\"\":80}\"",
                    "静音,system_setting,\"{\"\"setting\"\":\"\"mute\"\"}\""), StandardCharsets.UTF_8);

            CliResult result = execute("replay", csv.toString());

            assertTrue(result.output().contains("Intent accuracy:  2/3 (66.7%)"), result.output());
            assertTrue(result.output().contains("Overall accuracy: 1/3 (33.3%)"));
            assertTrue(result.output().contains("expected web_search, got clarify"));
            assertTrue(result.output().contains("Slot value: value differs too much"));
        }

        @Test
        @DisplayName("missing file is reported")
        void missingFile() {
            CliResult result = execute("replay", tempDir.resolve("absent.csv").toString());
            assertTrue(result.output().contains("Replay file not found"));
        }
    }
}
