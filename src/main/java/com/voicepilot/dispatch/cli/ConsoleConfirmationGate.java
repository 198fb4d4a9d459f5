package com.voicepilot.dispatch.cli;

import com.voicepilot.core.execution.ConfirmationGate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Set;

/**
 * Asks for confirmation on the terminal. Only an explicit yes approves; end of input declines.
 */
public class ConsoleConfirmationGate implements ConfirmationGate {

    private static final Set<String> YES = Set.of("y", "yes", "是", "好", "确认");

    private final BufferedReader input;

    public ConsoleConfirmationGate(BufferedReader input) {
        this.input = input;
    }

    @Override
    public boolean ask(String prompt) throws InterruptedException {
        ConsoleOutput.confirm(prompt);
        String answer;
        try {
            answer = input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
        if (Thread.interrupted()) {
            throw new InterruptedException("confirmation interrupted");
        }
        return answer != null && YES.contains(answer.trim().toLowerCase());
    }
}
