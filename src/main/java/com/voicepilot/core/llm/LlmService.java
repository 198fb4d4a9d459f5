package com.voicepilot.core.llm;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin wrapper around Spring AI's {@link ChatClient} that sends one system + user
 * prompt and returns the raw text of the completion.
 * <p>
 * Calls block the caller for at most {@code voicepilot.llm.request-timeout-seconds}.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;

    private final ExecutorService callExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "llm-call");
        t.setDaemon(true);
        return t;
    });

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("LlmService initialized, model {}", properties.getModel());
    }

    /**
     * Sends the request and waits for the completion text.
     *
     * @return the non-blank completion text
     * @throws LlmTimeoutException       when no answer arrives in time or the caller is interrupted
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws RuntimeException          any provider failure, unwrapped
     */
    public String complete(CompletionRequest request) {
        log.info("LLM call started, model {}", request.model());
        long start = System.currentTimeMillis();

        CompletableFuture<String> call = CompletableFuture.supplyAsync(() -> send(request), callExecutor);
        String response;
        try {
            response = call.get(properties.getRequestTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new LlmTimeoutException("LLM call exceeded " + properties.getRequestTimeoutSeconds() + "s", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmTimeoutException("LLM call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("LLM call failed: " + cause.getMessage(), cause);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for model " + request.model());
        }
        log.debug("Raw LLM response: {}", response);
        return response;
    }

    private String send(CompletionRequest request) {
        ChatOptions options = ChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .build();
        return chatClient.prompt()
                .system(request.system())
                .user(request.user())
                .options(options)
                .call()
                .content();
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }
}
