package com.voicepilot.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.ResolvedCommand;
import com.voicepilot.core.planner.PlanResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CLI command: voicepilot replay tasks.csv
 * <p>
 * Resolves every {@code utterance} of a CSV file with columns
 * {@code utterance,expected_intent,expected_slots} and reports intent, slot and overall accuracy.
 * A resolved plan is reported as intent {@code plan}. Rule-only unless {@code --llm} is given.
 */
@Command(name = "replay", mixinStandardHelpOptions = true, description = "Measure resolution accuracy against a CSV of labelled utterances")
@Component
public class ReplayCommand implements Runnable {

    private static final TypeReference<Map<String, Object>> SLOT_MAP = new TypeReference<>() {};
    private static final int MAX_REPORTED_FAILURES = 10;

    @Parameters(index = "0", description = "CSV file with utterance,expected_intent,expected_slots")
    private Path csv;

    @Option(names = "--llm", description = "Try generative parsing first")
    private boolean useLlm;

    record ReplayCase(String utterance, String expectedIntent, Map<String, Object> expectedSlots) {}

    private final PlanResolver planResolver;
    private final ObjectMapper objectMapper;

    public ReplayCommand(PlanResolver planResolver, ObjectMapper objectMapper) {
        this.planResolver = planResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (!Files.isRegularFile(csv)) {
            ConsoleOutput.error("Replay file not found: " + csv);
            return;
        }

        List<ReplayCase> cases;
        try {
            cases = load(csv);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read " + csv + ": " + e.getMessage());
            return;
        }
        if (cases.isEmpty()) {
            ConsoleOutput.warn("No replay cases in " + csv);
            return;
        }
        ConsoleOutput.info("Replaying " + cases.size() + " utterances (" + (useLlm ? "LLM" : "rule-based") + ")");

        int intentHits = 0;
        int slotHits = 0;
        int bothHits = 0;
        var failures = new ArrayList<String>();

        for (int i = 0; i < cases.size(); i++) {
            ReplayCase c = cases.get(i);
            ResolvedCommand command = planResolver.resolve(c.utterance(), useLlm).command();
            String predictedIntent = command.isPlan() ? "plan" : ((Intent) command).name().wireName();
            Map<String, Object> predictedSlots = command.isPlan() ? Map.of() : ((Intent) command).slots().toMap();

            boolean intentMatch = predictedIntent.equals(c.expectedIntent());
            Optional<String> slotMismatch = ReplayEvaluator.compareSlots(predictedSlots, c.expectedSlots());
            if (intentMatch) {
                intentHits++;
            }
            if (slotMismatch.isEmpty()) {
                slotHits++;
            }
            if (intentMatch && slotMismatch.isEmpty()) {
                bothHits++;
            } else {
                String issue = !intentMatch
                        ? "expected " + c.expectedIntent() + ", got " + predictedIntent
                        : slotMismatch.get();
                failures.add(String.format("%3d. %s: %s", i + 1, c.utterance(), issue));
            }
        }

        System.out.println();
        System.out.println("Intent accuracy:  " + ConsoleOutput.percent(intentHits, cases.size()));
        System.out.println("Slots accuracy:   " + ConsoleOutput.percent(slotHits, cases.size()));
        System.out.println("Overall accuracy: " + ConsoleOutput.percent(bothHits, cases.size()));

        if (!failures.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Failed cases (" + failures.size() + "):");
            failures.stream().limit(MAX_REPORTED_FAILURES).forEach(System.out::println);
        } else {
            ConsoleOutput.success("All cases passed.");
        }
    }

    List<ReplayCase> load(Path file) throws IOException {
        CsvMapper csvMapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        var cases = new ArrayList<ReplayCase>();
        try (MappingIterator<Map<String, String>> rows =
                     csvMapper.readerForMapOf(String.class).with(schema).readValues(file.toFile())) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                String utterance = row.getOrDefault("utterance", "").trim();
                if (utterance.isEmpty()) {
                    continue;
                }
                cases.add(new ReplayCase(utterance,
                        row.getOrDefault("expected_intent", "").trim(),
                        parseSlots(row.get("expected_slots"))));
            }
        }
        return cases;
    }

    private Map<String, Object> parseSlots(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, SLOT_MAP);
        } catch (JsonProcessingException e) {
            ConsoleOutput.warn("Ignoring unparseable expected_slots: " + json);
            return Map.of();
        }
    }
}
