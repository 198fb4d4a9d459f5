package com.voicepilot.core.execution;

import com.voicepilot.core.model.ExecutionResult;
import com.voicepilot.core.model.Intent;

/**
 * Performs one intent against the controlled environment (OS automation, shell, ...).
 * <p>
 * Called at most once per step and never retried. An exception thrown here is reported
 * as a failed {@link ExecutionResult} for the step.
 */
@FunctionalInterface
public interface Actuator {

    ExecutionResult execute(Intent intent);
}
