package com.voicepilot.core.model;

/**
 * Aggregate result of sequencing a plan or intent.
 */
public enum RunOutcome {
    /** Every step reached DONE. */
    COMPLETED,
    /** A step's execution failed; later steps were not run. */
    FAILED,
    /** The operator answered "no" at a confirmation gate. */
    DECLINED,
    /** Interrupted while confirming or executing. */
    CANCELLED
}
