package com.voicepilot.core.model;

/**
 * Whether the sequencer hands steps to the actuator or only describes them.
 */
public enum RunMode {
    EXECUTE,
    DRY
}
