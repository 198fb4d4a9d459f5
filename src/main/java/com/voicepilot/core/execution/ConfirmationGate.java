package com.voicepilot.core.execution;

/**
 * Asks an operator to approve an action. May block indefinitely.
 */
@FunctionalInterface
public interface ConfirmationGate {

    /**
     * @param prompt what is about to happen, in user-facing language
     * @return true to proceed, false to decline
     * @throws InterruptedException if the waiting thread is interrupted; the run is cancelled
     */
    boolean ask(String prompt) throws InterruptedException;
}
