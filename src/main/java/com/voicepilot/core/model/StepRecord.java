package com.voicepilot.core.model;

import java.io.Serializable;

/**
 * Final state of one step after a run.
 *
 * @param index  1-based position in the plan
 * @param intent the step
 * @param state  where the step ended up
 * @param result the actuator (or dry-run) result, null when the step never executed
 */
public record StepRecord(
    int index,
    Intent intent,
    StepState state,
    ExecutionResult result
) implements Serializable {}
