package com.voicepilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for VoicePilot.
 * Routes to subcommands: resolve, run, replay.
 */
@Command(
        name = "voicepilot",
        mixinStandardHelpOptions = true,
        version = "VoicePilot 0.1.0",
        description = "Turns spoken requests into validated, confirmation-gated commands",
        subcommands = {
                ResolveCommand.class,
                RunCommand.class,
                ReplayCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class VoicePilotCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given: show usage of the already-wired command line
        spec.commandLine().usage(System.out);
    }
}
