package com.voicepilot.core.model;

import java.util.List;

/**
 * A single structured command resolved from an utterance.
 * <p>
 * Intents are immutable; the safety escalator produces adjusted copies through
 * {@link #withSafety(Safety)} and {@link #withRequiresConfirmation(boolean)}.
 *
 * @param name                  which command this is
 * @param slots                 typed parameters, shape must match {@code name}
 * @param requiresConfirmation  whether an operator must approve before execution
 * @param spokenAcknowledgement short user-facing text (may be empty)
 * @param safety                risk classification
 */
public record Intent(
    IntentName name,
    IntentSlots slots,
    boolean requiresConfirmation,
    String spokenAcknowledgement,
    Safety safety
) implements ResolvedCommand {

    public Intent {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        if (slots == null) {
            throw new IllegalArgumentException("slots must not be null");
        }
        if (slots.intent() != name) {
            throw new IllegalArgumentException("slots of type " + slots.intent().wireName()
                    + " do not belong to intent " + name.wireName());
        }
        if (safety == null) {
            throw new IllegalArgumentException("safety must not be null");
        }
        spokenAcknowledgement = spokenAcknowledgement != null ? spokenAcknowledgement : "";
    }

    /**
     * A clarification request. Always requires confirmation.
     */
    public static Intent clarify(String acknowledgement, Safety safety) {
        return new Intent(IntentName.CLARIFY, new IntentSlots.Clarify(), true, acknowledgement, safety);
    }

    public Intent withSafety(Safety newSafety) {
        return new Intent(name, slots, requiresConfirmation, spokenAcknowledgement, newSafety);
    }

    public Intent withRequiresConfirmation(boolean confirm) {
        return new Intent(name, slots, confirm, spokenAcknowledgement, safety);
    }

    /**
     * True if an operator must approve this intent before it runs: it asks for
     * confirmation or it carries high risk.
     */
    public boolean needsConfirmation() {
        return requiresConfirmation || safety.risk() == RiskLevel.HIGH;
    }

    public boolean isClarify() {
        return name == IntentName.CLARIFY;
    }

    @Override
    public List<Intent> steps() {
        return List.of(this);
    }
}
