package com.voicepilot.dispatch.cli;

import com.voicepilot.core.events.VoicePilotEvent;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the VoicePilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) VOICEPILOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [VOICEPILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void confirm(String prompt) {
        System.out.print(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [CONFIRM]|@ " + prompt + " [y/N] "));
        System.out.flush();
    }

    public static void event(VoicePilotEvent event) {
        String prefix = switch (event.eventType()) {
            case STEP_CONFIRMING -> "@|fg(yellow) [CONFIRM]|@";
            case STEP_STARTED -> "@|fg(blue) [STEP]|@";
            case STEP_COMPLETED -> "@|fg(green) [DONE]|@";
            case STEP_FAILED -> "@|fg(red),bold [FAILED]|@";
            case RUN_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case RUN_ABORTED -> "@|fg(red),bold [ABORTED]|@";
            case UTTERANCE_RESOLVED -> "@|fg(white) [" + event.eventType().wireName() + "]|@";
        };
        String step = event.isStepEvent() ? "step " + event.stepIndex() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + step + event.payload()));
    }

    public static String percent(int hits, int total) {
        return hits + "/" + total + " (" + String.format(Locale.ROOT, "%.1f", total == 0 ? 0.0 : hits * 100.0 / total) + "%)";
    }
}
