package com.pipewright.dispatch.cli;

import com.pipewright.core.engine.RunOrchestrator;
import com.pipewright.core.engine.RunOutcome;
import com.pipewright.core.engine.StartRequest;
import com.pipewright.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: pipewright start &lt;reference-id&gt;
 * <p>
 * Runs admission checks, claims the work item, allocates a workspace and
 * executes the first step of the template.
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a new run for a work item")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Reference id of the work item (e.g. an issue number)")
    private String referenceId;

    @Option(names = {"--template", "-t"}, description = "Pipeline template (default: configured default)")
    private String template;

    @Option(names = {"--branch", "-b"}, description = "Branch for the workspace (default: derived from the run id)")
    private String branch;

    @Option(names = "--skip-admission", description = "Start without admission checks")
    private boolean skipAdmission;

    @Option(names = "--skip-expensive", description = "Skip expensive admission checks such as the self-test")
    private boolean skipExpensive;

    private final RunOrchestrator orchestrator;
    private final EventBus eventBus;

    public StartCommand(RunOrchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Starting run for " + referenceId + "...");

        RunOutcome outcome;
        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        try {
            outcome = orchestrator.start(new StartRequest(referenceId, template, skipAdmission, skipExpensive, branch));
        } catch (RuntimeException e) {
            ConsoleOutput.error("Run failed: " + e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
        return ConsoleOutput.outcome(outcome);
    }
}
