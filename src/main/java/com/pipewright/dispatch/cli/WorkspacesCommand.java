package com.pipewright.dispatch.cli;

import com.pipewright.core.workspace.WorkspaceAllocator;
import com.pipewright.core.workspace.WorkspaceSlot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: pipewright workspaces
 */
@Command(name = "workspaces", mixinStandardHelpOptions = true, description = "List, release or prune workspace slots")
@Component
public class WorkspacesCommand implements Callable<Integer> {

    @Option(names = "--release", paramLabel = "RUN", description = "Remove the workspace of this run")
    private String release;

    @Option(names = "--prune-hours", paramLabel = "N",
            description = "Free slots whose worktree is gone or that are older than N hours")
    private Integer pruneHours;

    private final WorkspaceAllocator workspaces;

    public WorkspacesCommand(WorkspaceAllocator workspaces) {
        this.workspaces = workspaces;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (release != null) {
            if (workspaces.release(release)) {
                ConsoleOutput.success("Released workspace of run " + release);
                return 0;
            }
            ConsoleOutput.error("No workspace slot for run " + release);
            return 1;
        }
        if (pruneHours != null) {
            List<String> pruned = workspaces.prune(Duration.ofHours(pruneHours));
            ConsoleOutput.success("Pruned " + pruned.size() + " slot(s)" + (pruned.isEmpty() ? "" : ": " + pruned));
            return 0;
        }

        List<WorkspaceSlot> slots = workspaces.list();
        ConsoleOutput.info("Slots in use: " + slots.size() + "/" + workspaces.capacity());
        if (slots.isEmpty()) {
            return 0;
        }
        System.out.println();
        System.out.printf("  %-5s %-10s %-12s %-28s %s%n", "SLOT", "RUN", "PORTS", "BRANCH", "PATH");
        System.out.println("  " + "-".repeat(86));
        for (WorkspaceSlot slot : slots) {
            System.out.printf("  %-5d %-10s %-12s %-28s %s%n",
                    slot.slot(), slot.runId(), slot.ports().backend() + "/" + slot.ports().frontend(),
                    ConsoleOutput.truncate(slot.branchName(), 28), slot.path());
        }
        return 0;
    }
}
