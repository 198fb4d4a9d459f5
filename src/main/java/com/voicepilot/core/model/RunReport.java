package com.voicepilot.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What happened when a plan or intent was sequenced.
 *
 * @param outcome aggregate outcome
 * @param steps   one record per step of the plan, in order
 * @param reason  human readable explanation for a non-COMPLETED outcome (empty otherwise)
 */
public record RunReport(
    RunOutcome outcome,
    List<StepRecord> steps,
    String reason
) implements Serializable {

    public RunReport {
        steps = List.copyOf(steps);
        reason = reason != null ? reason : "";
    }

    /** Results of the steps that reached the actuator (or the dry-run describer), in order. */
    public List<ExecutionResult> results() {
        return steps.stream()
                .map(StepRecord::result)
                .filter(Objects::nonNull)
                .toList();
    }

    public long completedSteps() {
        return steps.stream().filter(s -> s.state() == StepState.DONE).count();
    }

    /** The step whose execution failed, if the run halted on a failure. */
    public Optional<StepRecord> failedStep() {
        return steps.stream()
                .filter(s -> s.result() != null && !s.result().succeeded())
                .findFirst();
    }

    public String summary() {
        int total = steps.size();
        return switch (outcome) {
            case COMPLETED -> "completed " + total + " of " + total + " step" + (total != 1 ? "s" : "");
            case FAILED -> failedStep()
                    .map(s -> "completed " + completedSteps() + " of " + total + " steps; step " + s.index()
                            + " (" + s.intent().name().wireName() + ") failed: "
                            + (s.result().error().isEmpty() ? s.result().message() : s.result().error()))
                    .orElse("failed: " + reason);
            case DECLINED -> "declined after " + completedSteps() + " of " + total + " steps: " + reason;
            case CANCELLED -> "cancelled after " + completedSteps() + " of " + total + " steps: " + reason;
        };
    }
}
