package com.pipewright.dispatch.cli;

import com.pipewright.core.idempotency.RunStatusRepository;
import com.pipewright.core.lock.OwnershipLock;
import com.pipewright.core.model.WorkRecord;
import com.pipewright.core.state.WorkRecordStore;
import com.pipewright.core.workspace.WorkspaceAllocator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: pipewright purge &lt;run-id&gt;
 * <p>
 * Abandons a run: removes its workspace, releases its lock and recorded
 * status, and deletes its stored state.
 */
@Command(name = "purge", mixinStandardHelpOptions = true, description = "Abandon a run and remove everything it holds")
@Component
public class PurgeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run id")
    private String runId;

    private final WorkRecordStore store;
    private final WorkspaceAllocator workspaces;
    private final OwnershipLock lock;
    private final RunStatusRepository statusRepository;

    public PurgeCommand(WorkRecordStore store, WorkspaceAllocator workspaces, OwnershipLock lock,
                        RunStatusRepository statusRepository) {
        this.store = store;
        this.workspaces = workspaces;
        this.lock = lock;
        this.statusRepository = statusRepository;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean found = false;
        if (workspaces.release(runId)) {
            ConsoleOutput.success("Removed workspace");
            found = true;
        }

        Optional<WorkRecord> record = store.load(runId);
        if (record.isPresent()) {
            String referenceId = record.get().referenceId();
            if (lock.release(referenceId, runId)) {
                ConsoleOutput.success("Released lock on " + referenceId);
            }
            statusRepository.find(referenceId)
                    .filter(status -> runId.equals(status.runId()))
                    .ifPresent(status -> {
                        statusRepository.delete(referenceId);
                        ConsoleOutput.success("Cleared recorded status of " + referenceId);
                    });
            if (store.delete(runId)) {
                ConsoleOutput.success("Deleted state");
            }
            found = true;
        }

        if (!found) {
            ConsoleOutput.error("Run not found: " + runId);
            return 1;
        }
        ConsoleOutput.info("Run " + runId + " purged");
        return 0;
    }
}
