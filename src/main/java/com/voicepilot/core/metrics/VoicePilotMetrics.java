package com.voicepilot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for utterance resolution and step execution.
 */
@Service
public class VoicePilotMetrics {

    private final MeterRegistry registry;

    public VoicePilotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param source "generative", "rules" or "split"
     */
    public void recordResolution(String source) {
        Counter.builder("voicepilot.resolutions.total")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordGenerativeCall(long ms, boolean succeeded) {
        Timer.builder("voicepilot.generative.duration")
                .tag("result", succeeded ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGenerativeAttempts(int attempts) {
        DistributionSummary.builder("voicepilot.generative.attempts")
                .description("Service calls needed per generative parse")
                .register(registry)
                .record(attempts);
    }

    public void recordGenerativeFailure(String kind) {
        Counter.builder("voicepilot.generative.failures")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementEscalations() {
        Counter.builder("voicepilot.safety.escalations")
                .description("Intents raised to high risk by the dangerous-operation detector")
                .register(registry)
                .increment();
    }

    public void recordStepExecution(String intent, long ms, boolean succeeded) {
        Timer.builder("voicepilot.step.duration")
                .tag("intent", intent)
                .tag("result", succeeded ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunOutcome(String outcome) {
        Counter.builder("voicepilot.runs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
