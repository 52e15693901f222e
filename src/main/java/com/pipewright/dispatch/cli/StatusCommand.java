package com.pipewright.dispatch.cli;

import com.pipewright.core.lock.OwnershipLock;
import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import com.pipewright.core.model.WorkRecord;
import com.pipewright.core.pipeline.PipelineCatalog;
import com.pipewright.core.pipeline.PipelineTemplate;
import com.pipewright.core.state.StoredRecord;
import com.pipewright.core.state.WorkRecordStore;
import com.pipewright.core.validation.OutputValidator;
import com.pipewright.core.validation.ValidationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: pipewright status &lt;run-id&gt;
 * <p>
 * Shows the stored state of a run and validates each step of its template
 * against the recorded output.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show run state and per-step validation")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run id")
    private String runId;

    private final WorkRecordStore store;
    private final OutputValidator validator;
    private final PipelineCatalog catalog;
    private final OwnershipLock lock;

    public StatusCommand(WorkRecordStore store, OutputValidator validator, PipelineCatalog catalog,
                         OwnershipLock lock) {
        this.store = store;
        this.validator = validator;
        this.catalog = catalog;
        this.lock = lock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<StoredRecord> stored = store.locate(runId);
        if (stored.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return 1;
        }
        stored.get().warnings().forEach(ConsoleOutput::warn);
        WorkRecord record = stored.get().record();

        System.out.println();
        System.out.println("RUN " + record.runId());
        System.out.println("Work item: " + record.referenceId());
        System.out.println("Template: " + record.templateName());
        System.out.println("Current step: " + (record.currentStep() != null ? record.currentStep() : "-"));

        RunStatus status = record.status();
        if (status == RunStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + status.label());
        } else if (status == RunStatus.FAILED) {
            ConsoleOutput.error("Status: " + status.label());
        } else {
            ConsoleOutput.info("Status: " + status.label());
        }

        if (record.workspacePath() != null) {
            ConsoleOutput.info("Workspace: " + record.workspacePath()
                    + (record.ports() != null
                        ? " (ports " + record.ports().backend() + "/" + record.ports().frontend() + ")"
                        : ""));
        }
        if (record.branchName() != null) {
            ConsoleOutput.info("Branch: " + record.branchName());
        }
        lock.find(record.referenceId()).ifPresentOrElse(
                held -> ConsoleOutput.info("Lock: held by run " + held.runId() + " (" + held.status().label() + ")"),
                () -> ConsoleOutput.info("Lock: not held"));

        List<Step> steps = catalog.find(record.templateName())
                .map(PipelineTemplate::steps)
                .orElse(List.copyOf(record.results().keySet()));
        if (!steps.isEmpty()) {
            System.out.println();
            System.out.printf("  %-10s %-10s %-10s %s%n", "STEP", "EXECUTED", "OUTPUT", "DETAIL");
            System.out.println("  " + "-".repeat(64));
            for (Step step : steps) {
                ValidationResult validation = validator.validate(step, record);
                String detail = validation.valid()
                        ? (validation.warnings().isEmpty() ? "" : validation.warnings().get(0))
                        : validation.errors().get(0);
                System.out.printf("  %-10s %-10s %-10s %s%n",
                        step, record.hasExecuted(step) ? "yes" : "no",
                        validation.valid() ? "valid" : "invalid",
                        ConsoleOutput.truncate(detail, 48));
            }
        }

        if (!record.errors().isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + record.errors().size() + "):");
            for (String e : record.errors()) {
                ConsoleOutput.error("  " + e);
            }
        }
        return 0;
    }
}
