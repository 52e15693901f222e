package com.pipewright.dispatch.cli;

import com.pipewright.core.engine.RunOrchestrator;
import com.pipewright.core.engine.RunOutcome;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.model.Step;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * CLI command: pipewright step &lt;run-id&gt; &lt;step&gt;
 * <p>
 * Executes one step of an existing run. Chained step processes are started
 * with this command; it never claims the work item, it requires the run to
 * hold it already.
 */
@Command(name = "step", mixinStandardHelpOptions = true, description = "Execute one step of an existing run")
@Component
public class StepCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run id")
    private String runId;

    @Parameters(index = "1", description = "Step name (e.g. build, test)")
    private String stepName;

    private final RunOrchestrator orchestrator;
    private final EventBus eventBus;

    public StepCommand(RunOrchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        Step step = Step.fromName(stepName);
        if (step == null) {
            ConsoleOutput.error("Unknown step: " + stepName + ". Valid steps: " + Arrays.toString(Step.values()));
            return 2;
        }

        RunOutcome outcome;
        var subscription = eventBus.subscribe(runId, ConsoleOutput::event);
        try {
            outcome = orchestrator.runStep(runId, step);
        } catch (RuntimeException e) {
            ConsoleOutput.error(step + " failed: " + e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
        return ConsoleOutput.outcome(outcome);
    }
}
