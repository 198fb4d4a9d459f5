package com.voicepilot.core.events;

/**
 * Kinds of events published while an utterance is resolved and run.
 */
public enum EventType {

    UTTERANCE_RESOLVED("utterance.resolved", false),
    STEP_CONFIRMING("step.confirming", false),
    STEP_STARTED("step.started", false),
    STEP_COMPLETED("step.completed", false),
    STEP_FAILED("step.failed", false),
    RUN_COMPLETED("run.completed", true),
    RUN_ABORTED("run.aborted", true);

    private final String wireName;
    private final boolean terminal;

    EventType(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    public String wireName() {
        return wireName;
    }

    /** True for the last event of a run; nothing more is published for that utterance. */
    public boolean isTerminal() {
        return terminal;
    }
}
