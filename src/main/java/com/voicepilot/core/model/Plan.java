package com.voicepilot.core.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An ordered multi-step task. Step order is execution order.
 *
 * @param steps   the intents to run, never empty
 * @param summary human readable description of the whole plan (not used for execution)
 */
public record Plan(
    List<Intent> steps,
    String summary
) implements ResolvedCommand {

    public Plan {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("a plan needs at least one step");
        }
        steps = List.copyOf(steps);
        summary = summary != null ? summary : "";
    }

    /** Returns a plan with every step replaced by {@code fn(step)}, same order and summary. */
    public Plan mapSteps(UnaryOperator<Intent> fn) {
        return new Plan(steps.stream().map(fn).toList(), summary);
    }

    /**
     * True if any step needs confirmation or carries high risk. Such plans get one
     * plan-level confirmation before the first step runs.
     */
    public boolean needsPlanConfirmation() {
        return steps.stream().anyMatch(Intent::needsConfirmation);
    }
}
