package com.pipewright.dispatch.cli;

import com.pipewright.core.engine.RunOrchestrator;
import com.pipewright.core.engine.RunOutcome;
import com.pipewright.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: pipewright resume &lt;run-id&gt;
 * <p>
 * Continues a run from the first step whose output does not validate.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a run from its first incomplete step")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run id")
    private String runId;

    private final RunOrchestrator orchestrator;
    private final EventBus eventBus;

    public ResumeCommand(RunOrchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming run " + runId + "...");

        RunOutcome outcome;
        var subscription = eventBus.subscribe(runId, ConsoleOutput::event);
        try {
            outcome = orchestrator.resume(runId);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Resume failed: " + e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
        return ConsoleOutput.outcome(outcome);
    }
}
