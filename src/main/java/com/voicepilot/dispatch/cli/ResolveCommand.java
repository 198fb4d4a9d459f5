package com.voicepilot.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicepilot.core.planner.PlanResolver;
import com.voicepilot.core.planner.Resolution;
import com.voicepilot.core.schema.CommandSchema;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: voicepilot resolve "&lt;utterance&gt;"
 * <p>
 * Resolves an utterance and prints the resulting intent or plan as JSON. Nothing is executed.
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve an utterance without executing it")
@Component
public class ResolveCommand implements Runnable {

    @Parameters(arity = "1..*", description = "The utterance to resolve")
    private List<String> words;

    @Option(names = "--no-llm", description = "Use the rule matcher only")
    private boolean noLlm;

    private final PlanResolver planResolver;
    private final CommandSchema schema;
    private final ObjectMapper objectMapper;

    public ResolveCommand(PlanResolver planResolver, CommandSchema schema, ObjectMapper objectMapper) {
        this.planResolver = planResolver;
        this.schema = schema;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        String text = String.join(" ", words);
        Resolution resolution = noLlm ? planResolver.resolve(text, false) : planResolver.resolve(text);

        ConsoleOutput.info("Utterance " + resolution.utteranceId() + " resolved via " + resolution.source());
        if (resolution.generativeFailure() != null) {
            ConsoleOutput.warn("Generative parsing failed (" + resolution.generativeFailure().kind() + "): "
                    + resolution.generativeFailure().detail());
        }
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(schema.toPayload(resolution.command())));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Could not render command: " + e.getOriginalMessage());
        }
    }
}
