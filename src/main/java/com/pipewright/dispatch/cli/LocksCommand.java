package com.pipewright.dispatch.cli;

import com.pipewright.core.lock.LockRecord;
import com.pipewright.core.lock.OwnershipLock;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: pipewright locks
 * <p>
 * Lists ownership locks, or releases and prunes them. Releasing needs either
 * the holding run id or {@code --force}.
 */
@Command(name = "locks", mixinStandardHelpOptions = true, description = "List, release or prune ownership locks")
@Component
public class LocksCommand implements Callable<Integer> {

    @Option(names = "--release", paramLabel = "REF", description = "Release the lock on this work item")
    private String release;

    @Option(names = "--run", description = "Run id expected to hold the lock being released")
    private String runId;

    @Option(names = "--force", description = "Release regardless of which run holds the lock")
    private boolean force;

    @Option(names = "--prune-hours", paramLabel = "N", description = "Release locks not updated for N hours")
    private Integer pruneHours;

    private final OwnershipLock lock;

    public LocksCommand(OwnershipLock lock) {
        this.lock = lock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (release != null) {
            return release();
        }
        if (pruneHours != null) {
            int released = lock.releaseStale(Duration.ofHours(pruneHours));
            ConsoleOutput.success("Released " + released + " stale lock(s)");
            return 0;
        }

        List<LockRecord> active = lock.listActive();
        if (active.isEmpty()) {
            ConsoleOutput.info("No active locks.");
            return 0;
        }
        System.out.printf("  %-20s %-10s %-10s %-22s %s%n", "WORK ITEM", "RUN", "STATUS", "ACQUIRED", "UPDATED");
        System.out.println("  " + "-".repeat(86));
        for (LockRecord record : active) {
            System.out.printf("  %-20s %-10s %-10s %-22s %s%n",
                    ConsoleOutput.truncate(record.referenceId(), 20), record.runId(), record.status().label(),
                    record.acquiredAt(), record.updatedAt());
        }
        return 0;
    }

    private int release() {
        boolean released;
        if (force) {
            released = lock.forceRelease(release);
        } else if (runId != null) {
            released = lock.release(release, runId);
        } else {
            ConsoleOutput.error("Releasing a lock needs --run <run-id> or --force");
            return 2;
        }
        if (released) {
            ConsoleOutput.success("Released lock on " + release);
            return 0;
        }
        ConsoleOutput.error("No lock on " + release + (runId != null && !force ? " held by run " + runId : ""));
        return 1;
    }
}
