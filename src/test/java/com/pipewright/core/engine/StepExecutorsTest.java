package com.pipewright.core.engine;

import com.pipewright.core.model.CleanupOutput;
import com.pipewright.core.model.Step;
import com.pipewright.core.workspace.WorkspaceAllocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StepExecutorsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("registry falls back to the default executor for unregistered steps")
    void registry() {
        StepExecutor fallback = context -> StepExecution.infrastructureError("default");
        StepExecutor cleanup = context -> StepExecution.infrastructureError("cleanup");
        var registry = new StepExecutorRegistry(fallback).register(Step.CLEANUP, cleanup);

        assertSame(fallback, registry.forStep(Step.BUILD));
        assertSame(cleanup, registry.forStep(Step.CLEANUP));
    }

    @Test
    @DisplayName("cleanup releases the run's workspace and reports what it freed")
    void cleanupReleasesWorkspace() {
        var allocator = mock(WorkspaceAllocator.class);
        when(allocator.release("run-1")).thenReturn(true);
        var context = new StepContext("run-1", "ISSUE-1", "sdlc_complete", Step.CLEANUP,
                tempDir.resolve("trees/run-1"), null);

        StepExecution execution = new CleanupStepExecutor(allocator).execute(context);

        verify(allocator).release("run-1");
        assertEquals(StepExecution.Outcome.SUCCEEDED, execution.outcome());
        assertEquals(new CleanupOutput(true, true), execution.result().output());
    }

    @Test
    @DisplayName("launcher invokes the CLI step command for the run")
    void launcherCommand() {
        var launcher = new ProcessStepLauncher(List.of("java", "-jar", "pipewright.jar"), tempDir);

        assertEquals(List.of("java", "-jar", "pipewright.jar", "step", "run-1", "build"),
                launcher.command("run-1", Step.BUILD));
    }

    @Test
    @DisplayName("launch failures surface as launch exceptions")
    void launchFailure() {
        var launcher = new ProcessStepLauncher(List.of("/nonexistent/pipewright"), tempDir);

        assertThrows(StepLauncher.StepLaunchException.class, () -> launcher.launch("run-1", Step.TEST));
    }

    @Test
    @DisplayName("run ids are eight hex characters")
    void runIds() {
        String runId = RunIds.newRunId();

        assertTrue(runId.matches("[0-9a-f]{8}"), runId);
        assertNotEquals(runId, RunIds.newRunId());
    }
}
