package com.voicepilot.core.schema;

import java.util.List;

/**
 * Thrown when a raw payload does not satisfy the command schema.
 * Carries every violation found, not just the first.
 */
public class CommandValidationException extends RuntimeException {

    private final List<String> errors;

    public CommandValidationException(List<String> errors) {
        super("Invalid command payload: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
