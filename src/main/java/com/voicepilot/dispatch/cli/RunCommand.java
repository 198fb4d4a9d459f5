package com.voicepilot.dispatch.cli;

import com.voicepilot.core.events.EventBus;
import com.voicepilot.core.execution.Actuator;
import com.voicepilot.core.execution.ConfirmationGate;
import com.voicepilot.core.execution.StepSequencer;
import com.voicepilot.core.model.RunMode;
import com.voicepilot.core.model.RunOutcome;
import com.voicepilot.core.model.RunReport;
import com.voicepilot.core.model.StepRecord;
import com.voicepilot.core.planner.PlanResolver;
import com.voicepilot.core.planner.Resolution;
import com.voicepilot.core.verbalizer.Verbalizer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: voicepilot run "&lt;utterance&gt;"
 * <p>
 * Resolves an utterance and runs its steps. Confirmations are asked on the terminal
 * unless {@code --yes} is given. Without an {@link Actuator} bean the run is always a dry run.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Resolve an utterance and execute it")
@Component
public class RunCommand implements Runnable {

    @Parameters(arity = "1..*", description = "The utterance to run")
    private List<String> words;

    @Option(names = "--dry-run", description = "Describe each step instead of executing it")
    private boolean dryRun;

    @Option(names = "--no-llm", description = "Use the rule matcher only")
    private boolean noLlm;

    @Option(names = {"--yes", "-y"}, description = "Approve every confirmation automatically")
    private boolean autoApprove;

    private final PlanResolver planResolver;
    private final StepSequencer sequencer;
    private final Verbalizer verbalizer;
    private final EventBus eventBus;
    private final Actuator actuator;

    public RunCommand(PlanResolver planResolver, StepSequencer sequencer, Verbalizer verbalizer,
                      EventBus eventBus, Optional<Actuator> actuator) {
        this.planResolver = planResolver;
        this.sequencer = sequencer;
        this.verbalizer = verbalizer;
        this.eventBus = eventBus;
        this.actuator = actuator.orElse(null);
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String text = String.join(" ", words);

        Resolution resolution = noLlm ? planResolver.resolve(text, false) : planResolver.resolve(text);
        ConsoleOutput.info("Resolved via " + resolution.source() + " to "
                + resolution.command().steps().size() + " step(s)");

        RunMode mode = dryRun ? RunMode.DRY : RunMode.EXECUTE;
        Actuator target = actuator;
        if (mode == RunMode.EXECUTE && target == null) {
            ConsoleOutput.warn("No actuator configured, running as dry run");
            mode = RunMode.DRY;
        }
        if (target == null) {
            target = intent -> {
                throw new IllegalStateException("no actuator configured");
            };
        }

        ConfirmationGate gate = autoApprove
                ? prompt -> {
                    ConsoleOutput.info(prompt + " (auto-approved)");
                    return true;
                }
                : new ConsoleConfirmationGate(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));

        var subscription = eventBus.subscribe(resolution.utteranceId(), ConsoleOutput::event);
        RunReport report;
        try {
            report = sequencer.run(resolution.utteranceId(), resolution.command(), gate, target, mode);
        } finally {
            subscription.unsubscribe();
        }

        System.out.println();
        for (StepRecord step : report.steps()) {
            if (step.result() != null) {
                System.out.printf("  %d. [%-14s] %s%n", step.index(), step.intent().name().wireName(),
                        mode == RunMode.DRY ? step.result().message()
                                : verbalizer.resultMessage(step.intent(), step.result()));
            }
        }
        System.out.println();
        if (report.outcome() == RunOutcome.COMPLETED) {
            ConsoleOutput.success(report.summary());
        } else {
            ConsoleOutput.error(report.summary());
        }
    }
}
