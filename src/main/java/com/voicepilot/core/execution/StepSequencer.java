package com.voicepilot.core.execution;

import com.voicepilot.core.events.EventBus;
import com.voicepilot.core.events.EventType;
import com.voicepilot.core.logging.MdcContext;
import com.voicepilot.core.metrics.VoicePilotMetrics;
import com.voicepilot.core.model.ExecutionResult;
import com.voicepilot.core.model.Intent;
import com.voicepilot.core.model.Plan;
import com.voicepilot.core.model.ResolvedCommand;
import com.voicepilot.core.model.RunMode;
import com.voicepilot.core.model.RunOutcome;
import com.voicepilot.core.model.RunReport;
import com.voicepilot.core.model.StepRecord;
import com.voicepilot.core.model.StepState;
import com.voicepilot.core.verbalizer.Verbalizer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the steps of an intent or plan in order against an {@link Actuator}.
 * <p>
 * Per step: {@code PENDING → [CONFIRMING] → EXECUTING → DONE | ABORTED}.
 * <ul>
 *   <li>a step that asks for confirmation or carries high risk is only executed after the gate approves;
 *       a refusal ends the run as {@link RunOutcome#DECLINED}</li>
 *   <li>a plan with any confirming or high-risk step is confirmed once as a whole before step 1</li>
 *   <li>the first failed step ends the run as {@link RunOutcome#FAILED}; later steps stay PENDING</li>
 *   <li>an interrupt while confirming or executing ends the run as {@link RunOutcome#CANCELLED}</li>
 *   <li>in {@link RunMode#DRY} nothing is confirmed and the actuator is never called; each step
 *       gets a description of what would have run</li>
 * </ul>
 */
@Service
public class StepSequencer {

    private static final Logger log = LoggerFactory.getLogger(StepSequencer.class);

    private enum Answer { YES, NO, CANCELLED }

    private record StepExecution(ExecutionResult result, boolean cancelled) {}

    private final Verbalizer verbalizer;
    private final ExecutionProperties properties;
    private final EventBus eventBus;
    private final VoicePilotMetrics metrics;

    private final ExecutorService actuatorExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "actuator");
        t.setDaemon(true);
        return t;
    });

    public StepSequencer(Verbalizer verbalizer, ExecutionProperties properties,
                         EventBus eventBus, VoicePilotMetrics metrics) {
        this.verbalizer = verbalizer;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @param utteranceId correlation id for logs and events
     * @param command     the intent or plan to run
     * @param gate        asked before confirming steps (unused in dry mode)
     * @param actuator    performs steps (never called in dry mode)
     * @param mode        execute or dry run
     * @return one record per step plus the aggregate outcome
     */
    public RunReport run(String utteranceId, ResolvedCommand command, ConfirmationGate gate,
                         Actuator actuator, RunMode mode) {
        List<Intent> steps = command.steps();
        StepState[] states = new StepState[steps.size()];
        ExecutionResult[] results = new ExecutionResult[steps.size()];
        Arrays.fill(states, StepState.PENDING);

        MdcContext.setUtterance(utteranceId);
        try {
            log.info("Running {} step(s) for utterance {} in {} mode", steps.size(), utteranceId, mode);

            if (mode == RunMode.EXECUTE && command instanceof Plan plan && plan.needsPlanConfirmation()) {
                publish(EventType.STEP_CONFIRMING, utteranceId, null,
                        Map.of("scope", "plan", "steps", steps.size()));
                Answer answer = confirm(gate, verbalizer.planConfirmationPrompt(plan));
                if (answer == Answer.NO) {
                    return finish(utteranceId, steps, states, results, RunOutcome.DECLINED, "plan declined");
                }
                if (answer == Answer.CANCELLED) {
                    return finish(utteranceId, steps, states, results, RunOutcome.CANCELLED,
                            "cancelled during plan confirmation");
                }
            }

            for (int i = 0; i < steps.size(); i++) {
                Intent step = steps.get(i);
                int index = i + 1;
                String name = step.name().wireName();
                MdcContext.setStep(utteranceId, index, name);

                if (mode == RunMode.DRY) {
                    states[i] = StepState.EXECUTING;
                    publish(EventType.STEP_STARTED, utteranceId, index, Map.of("intent", name, "dryRun", true));
                    String description = verbalizer.dryRunDescription(step);
                    log.info(description);
                    results[i] = ExecutionResult.success(description, description);
                    states[i] = StepState.DONE;
                    publish(EventType.STEP_COMPLETED, utteranceId, index,
                            Map.of("intent", name, "message", description));
                    continue;
                }

                if (step.needsConfirmation()) {
                    states[i] = StepState.CONFIRMING;
                    publish(EventType.STEP_CONFIRMING, utteranceId, index, Map.of("intent", name));
                    Answer answer = confirm(gate, verbalizer.confirmationPrompt(step));
                    if (answer != Answer.YES) {
                        states[i] = StepState.ABORTED;
                        return answer == Answer.NO
                                ? finish(utteranceId, steps, states, results, RunOutcome.DECLINED,
                                        "step " + index + " (" + name + ") declined")
                                : finish(utteranceId, steps, states, results, RunOutcome.CANCELLED,
                                        "cancelled while confirming step " + index);
                    }
                }

                states[i] = StepState.EXECUTING;
                publish(EventType.STEP_STARTED, utteranceId, index, Map.of("intent", name));
                long start = System.currentTimeMillis();
                StepExecution execution = execute(actuator, step);
                if (execution.cancelled()) {
                    states[i] = StepState.ABORTED;
                    return finish(utteranceId, steps, states, results, RunOutcome.CANCELLED,
                            "cancelled while executing step " + index);
                }

                ExecutionResult result = execution.result();
                results[i] = result;
                metrics.recordStepExecution(name, System.currentTimeMillis() - start, result.succeeded());

                if (!result.succeeded()) {
                    states[i] = StepState.ABORTED;
                    log.warn("Step {} ({}) failed: {}", index, name, result.error());
                    publish(EventType.STEP_FAILED, utteranceId, index,
                            Map.of("intent", name, "error", result.error(), "message", result.message()));
                    return finish(utteranceId, steps, states, results, RunOutcome.FAILED,
                            result.error().isEmpty() ? result.message() : result.error());
                }

                states[i] = StepState.DONE;
                log.info("Step {} ({}) done: {}", index, name, result.message());
                publish(EventType.STEP_COMPLETED, utteranceId, index,
                        Map.of("intent", name, "message", result.message()));
            }

            return finish(utteranceId, steps, states, results, RunOutcome.COMPLETED, "");
        } finally {
            MdcContext.clear();
        }
    }

    private Answer confirm(ConfirmationGate gate, String prompt) {
        try {
            return gate.ask(prompt) ? Answer.YES : Answer.NO;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Confirmation interrupted");
            return Answer.CANCELLED;
        } catch (CancellationException e) {
            log.info("Confirmation cancelled");
            return Answer.CANCELLED;
        }
    }

    private StepExecution execute(Actuator actuator, Intent step) {
        int timeout = properties.getActuatorTimeoutSeconds();
        Future<ExecutionResult> call = actuatorExecutor.submit(() -> actuator.execute(step));
        try {
            ExecutionResult result = call.get(timeout, TimeUnit.SECONDS);
            if (result == null) {
                return new StepExecution(ExecutionResult.failure("Execution failed", "actuator returned no result"), false);
            }
            return new StepExecution(result, false);
        } catch (TimeoutException e) {
            call.cancel(true);
            return new StepExecution(ExecutionResult.failure("Execution timed out",
                    "Timeout after " + timeout + " seconds"), false);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return new StepExecution(null, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CancellationException) {
                return new StepExecution(null, true);
            }
            log.error("Actuator threw for {}: {}", step.name().wireName(), cause.getMessage(), cause);
            return new StepExecution(ExecutionResult.failure("Execution failed",
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), false);
        }
    }

    private RunReport finish(String utteranceId, List<Intent> steps, StepState[] states,
                             ExecutionResult[] results, RunOutcome outcome, String reason) {
        var records = new ArrayList<StepRecord>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            records.add(new StepRecord(i + 1, steps.get(i), states[i], results[i]));
        }
        RunReport report = new RunReport(outcome, records, reason);
        metrics.recordRunOutcome(outcome.name());
        MdcContext.clearStep();
        if (outcome == RunOutcome.COMPLETED) {
            log.info("Utterance {}: {}", utteranceId, report.summary());
            publish(EventType.RUN_COMPLETED, utteranceId, null,
                    Map.of("outcome", outcome.name(), "steps", steps.size()));
        } else {
            log.warn("Utterance {}: {}", utteranceId, report.summary());
            publish(EventType.RUN_ABORTED, utteranceId, null,
                    Map.of("outcome", outcome.name(), "reason", reason,
                            "completedSteps", report.completedSteps()));
        }
        return report;
    }

    private void publish(EventType type, String utteranceId, Integer stepIndex, Map<String, Object> payload) {
        eventBus.publish(type, utteranceId, stepIndex, payload);
    }

    @PreDestroy
    public void shutdown() {
        actuatorExecutor.shutdownNow();
    }
}
