package com.pipewright.core.engine;

import com.pipewright.core.model.CleanupOutput;
import com.pipewright.core.model.StepResult;
import com.pipewright.core.workspace.WorkspaceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

/**
 * Built-in executor for the cleanup step: removes the run's working tree and
 * frees its workspace slot. Runs in-process; no external command is involved.
 */
@Component
public class CleanupStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(CleanupStepExecutor.class);

    private final WorkspaceAllocator workspaces;

    public CleanupStepExecutor(WorkspaceAllocator workspaces) {
        this.workspaces = workspaces;
    }

    @Override
    public StepExecution execute(StepContext context) {
        boolean slotReleased = workspaces.release(context.runId());
        boolean workspaceRemoved = context.workspace() == null || !Files.exists(context.workspace());
        log.info("Cleanup for run {}: workspace removed={}, slot released={}",
                context.runId(), workspaceRemoved, slotReleased);
        return StepExecution.succeeded(StepResult.succeeded(new CleanupOutput(workspaceRemoved, slotReleased)));
    }
}
