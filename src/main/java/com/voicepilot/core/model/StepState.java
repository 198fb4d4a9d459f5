package com.voicepilot.core.model;

/**
 * Lifecycle of a single step while the sequencer drives a plan.
 */
public enum StepState {
    PENDING,
    CONFIRMING, // waiting on the operator
    EXECUTING,
    DONE,
    ABORTED
}
