package com.voicepilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * What an utterance resolves to: either a single {@link Intent} or a multi-step {@link Plan}.
 * Both expose their steps in execution order so a bare intent runs as a one-step plan.
 */
public interface ResolvedCommand extends Serializable {

    List<Intent> steps();

    default boolean isPlan() {
        return this instanceof Plan;
    }
}
