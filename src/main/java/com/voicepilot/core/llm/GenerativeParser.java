package com.voicepilot.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.voicepilot.core.metrics.VoicePilotMetrics;
import com.voicepilot.core.model.ResolvedCommand;
import com.voicepilot.core.prompt.PromptAssembler;
import com.voicepilot.core.prompt.PromptPayload;
import com.voicepilot.core.schema.CommandSchema;
import com.voicepilot.core.schema.CommandValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves an utterance through the generative service.
 * <p>
 * Each attempt assembles a prompt, calls {@link LlmService}, extracts the JSON object and
 * validates it against {@link CommandSchema}. After unparseable or invalid output the next
 * attempt uses the corrective prompt; after a timeout or service error it repeats the
 * original prompt. Attempts are sequential and capped at {@code voicepilot.llm.max-retries}.
 * <p>
 * No exception escapes {@link #parse(String)}: every failure is reported as a
 * {@link GenerationResult.Failure}. Falling back to rules is the caller's decision.
 */
@Service
public class GenerativeParser {

    private static final Logger log = LoggerFactory.getLogger(GenerativeParser.class);

    private final LlmService llmService;
    private final PromptAssembler promptAssembler;
    private final JsonPayloadExtractor extractor;
    private final CommandSchema schema;
    private final LlmProperties properties;
    private final VoicePilotMetrics metrics;

    public GenerativeParser(LlmService llmService, PromptAssembler promptAssembler,
                            JsonPayloadExtractor extractor, CommandSchema schema,
                            LlmProperties properties, VoicePilotMetrics metrics) {
        this.llmService = llmService;
        this.promptAssembler = promptAssembler;
        this.extractor = extractor;
        this.schema = schema;
        this.properties = properties;
        this.metrics = metrics;
    }

    public GenerationResult parse(String text) {
        int maxAttempts = Math.max(1, properties.getMaxRetries());
        PromptPayload prompt = promptAssembler.assemble(text);
        GenerationResult.Failure lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.info("LLM call attempt {}/{}", attempt, maxAttempts);
            long start = System.currentTimeMillis();
            GenerationResult result = attempt(prompt);
            metrics.recordGenerativeCall(System.currentTimeMillis() - start, result.isSuccess());

            if (result instanceof GenerationResult.Success success) {
                log.info("Generative parse succeeded on attempt {}", attempt);
                metrics.recordGenerativeAttempts(attempt);
                return new GenerationResult.Success(success.command(), attempt);
            }

            lastFailure = (GenerationResult.Failure) result;
            metrics.recordGenerativeFailure(lastFailure.kind().name());
            log.warn("Generative attempt {} failed ({}): {}", attempt, lastFailure.kind(), lastFailure.detail());

            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (lastFailure.kind() == FailureKind.PARSE_ERROR || lastFailure.kind() == FailureKind.VALIDATION_ERROR) {
                prompt = promptAssembler.corrective(text);
            }
        }

        log.warn("All generative attempts failed, last failure {}", lastFailure.kind());
        return lastFailure;
    }

    private GenerationResult attempt(PromptPayload prompt) {
        String raw;
        try {
            raw = llmService.complete(new CompletionRequest(
                    properties.getModel(),
                    properties.getTemperature(),
                    properties.getMaxTokens(),
                    prompt.system(),
                    prompt.user()));
        } catch (LlmTimeoutException e) {
            return new GenerationResult.Failure(FailureKind.TIMEOUT, e.getMessage());
        } catch (RuntimeException e) {
            return new GenerationResult.Failure(FailureKind.SERVICE_ERROR, e.getMessage());
        }

        JsonNode payload;
        try {
            payload = extractor.extract(raw);
        } catch (LlmParseException e) {
            log.debug("Unparseable LLM output: {}", raw);
            return new GenerationResult.Failure(FailureKind.PARSE_ERROR, e.getMessage());
        }

        try {
            ResolvedCommand command = schema.validate(payload);
            return new GenerationResult.Success(command, 1);
        } catch (CommandValidationException e) {
            return new GenerationResult.Failure(FailureKind.VALIDATION_ERROR, String.join("; ", e.getErrors()));
        } catch (IllegalArgumentException e) {
            return new GenerationResult.Failure(FailureKind.VALIDATION_ERROR, e.getMessage());
        }
    }
}
