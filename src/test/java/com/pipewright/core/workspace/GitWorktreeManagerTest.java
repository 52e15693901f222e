package com.pipewright.core.workspace;

import com.pipewright.core.process.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link GitWorktreeManager}, with git replaced by a mocked {@link ProcessRunner}
 * so command construction and output parsing are checked without a real repository.
 */
class GitWorktreeManagerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    @TempDir
    Path repoRoot;

    private ProcessRunner runner;
    private GitWorktreeManager git;

    @BeforeEach
    void setUp() {
        runner = mock(ProcessRunner.class);
        git = new GitWorktreeManager(TIMEOUT, runner);
    }

    private void gitReturns(List<String> command, int exitCode, String output) throws IOException {
        when(runner.run(eq(command), eq(repoRoot), eq(TIMEOUT)))
                .thenReturn(new ProcessRunner.Result(exitCode, output, false));
    }

    @Nested
    @DisplayName("addWorktree")
    class AddTests {

        @Test
        @DisplayName("creates a new branch from the base ref")
        void newBranch() throws IOException {
            Path tree = repoRoot.resolve("trees/run-1");
            gitReturns(List.of("git", "worktree", "add", "-b", "pipewright/run-1", tree.toString(), "HEAD"),
                    0, "Preparing worktree (new branch 'pipewright/run-1')");

            var result = git.addWorktree(repoRoot, tree, "pipewright/run-1", "HEAD");

            assertTrue(result.success());
            assertEquals(tree, result.worktreePath());
            verify(runner, never()).run(eq(List.of("git", "worktree", "add", tree.toString(), "pipewright/run-1")),
                    any(), any());
        }

        @Test
        @DisplayName("retries without -b when the branch already exists")
        void existingBranch() throws IOException {
            Path tree = repoRoot.resolve("trees/run-1");
            gitReturns(List.of("git", "worktree", "add", "-b", "pipewright/run-1", tree.toString(), "HEAD"),
                    128, "fatal: a branch named 'pipewright/run-1' already exists");
            gitReturns(List.of("git", "worktree", "add", tree.toString(), "pipewright/run-1"),
                    0, "Preparing worktree (checking out 'pipewright/run-1')");

            var result = git.addWorktree(repoRoot, tree, "pipewright/run-1", "HEAD");

            assertTrue(result.success());
            verify(runner).run(List.of("git", "worktree", "add", tree.toString(), "pipewright/run-1"), repoRoot, TIMEOUT);
        }

        @Test
        @DisplayName("reports the exit code and output when both attempts fail")
        void bothFail() throws IOException {
            Path tree = repoRoot.resolve("trees/run-1");
            gitReturns(List.of("git", "worktree", "add", "-b", "b", tree.toString(), "HEAD"), 128, "fatal: first");
            gitReturns(List.of("git", "worktree", "add", tree.toString(), "b"), 128,
                    "fatal: 'b' is already checked out at '/elsewhere'\n");

            var result = git.addWorktree(repoRoot, tree, "b", "HEAD");

            assertFalse(result.success());
            assertTrue(result.error().contains("exit code 128"));
            assertTrue(result.error().endsWith("is already checked out at '/elsewhere'"));
        }

        @Test
        @DisplayName("a missing repository root fails without running git")
        void missingRepo() throws IOException {
            var result = git.addWorktree(repoRoot.resolve("nope"), repoRoot.resolve("t"), "b", "HEAD");

            assertFalse(result.success());
            verify(runner, never()).run(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("removeWorktree")
    class RemoveTests {

        @Test
        @DisplayName("removes with --force")
        void forceRemove() throws IOException {
            Path tree = repoRoot.resolve("trees/run-1");
            gitReturns(List.of("git", "worktree", "remove", "--force", tree.toString()), 0, "");

            assertTrue(git.removeWorktree(repoRoot, tree));
            verify(runner, never()).run(eq(List.of("git", "worktree", "prune")), any(), any());
        }

        @Test
        @DisplayName("falls back to deleting the directory and pruning when git refuses")
        void manualFallback() throws IOException {
            Path tree = Files.createDirectories(repoRoot.resolve("trees/run-1"));
            Files.writeString(Files.createDirectories(tree.resolve("src")).resolve("App.java"), "class App {}");
            Files.writeString(tree.resolve(".ports.env"), "BACKEND_PORT=9100\n");
            gitReturns(List.of("git", "worktree", "remove", "--force", tree.toString()), 128,
                    "fatal: '" + tree + "' is not a working tree");
            gitReturns(List.of("git", "worktree", "prune"), 0, "");

            assertTrue(git.removeWorktree(repoRoot, tree));
            assertFalse(Files.exists(tree));
            verify(runner).run(List.of("git", "worktree", "prune"), repoRoot, TIMEOUT);
        }
    }

    @Nested
    @DisplayName("worktree listing")
    class ListTests {

        @Test
        @DisplayName("parses the porcelain listing and matches registered worktrees")
        void registered() throws IOException {
            Path tree = Files.createDirectories(repoRoot.resolve("trees/run-1"));
            String porcelain = "worktree " + repoRoot + "\n"
                    + "HEAD 1f2e3d4c5b6a\n"
                    + "branch refs/heads/main\n"
                    + "\n"
                    + "worktree " + tree + "\n"
                    + "HEAD 1f2e3d4c5b6a\n"
                    + "branch refs/heads/pipewright/run-1\n";
            gitReturns(List.of("git", "worktree", "list", "--porcelain"), 0, porcelain);

            assertEquals(List.of(repoRoot, tree), git.listWorktrees(repoRoot));
            assertTrue(git.isRegisteredWorktree(repoRoot, tree));
            assertTrue(git.isRegisteredWorktree(repoRoot, repoRoot.resolve("trees/../trees/run-1")));
            assertFalse(git.isRegisteredWorktree(repoRoot, repoRoot.resolve("trees/run-2")));
        }

        @Test
        @DisplayName("a failing listing knows no worktrees")
        void listingFails() throws IOException {
            gitReturns(List.of("git", "worktree", "list", "--porcelain"), 128, "fatal: not a git repository");

            assertTrue(git.listWorktrees(repoRoot).isEmpty());
            assertFalse(git.isRegisteredWorktree(repoRoot, repoRoot.resolve("trees/run-1")));
        }
    }

    @Nested
    @DisplayName("git failures")
    class FailureTests {

        @Test
        @DisplayName("status lines are returned without blanks")
        void status() throws IOException {
            gitReturns(List.of("git", "status", "--porcelain"), 0, " M src/App.java\n?? notes.txt\n\n");

            assertEquals(List.of(" M src/App.java", "?? notes.txt"), git.statusPorcelain(repoRoot));
        }

        @Test
        @DisplayName("a timed out command raises instead of reporting an exit code")
        void timeout() throws IOException {
            when(runner.run(eq(List.of("git", "status", "--porcelain")), eq(repoRoot), eq(TIMEOUT)))
                    .thenReturn(new ProcessRunner.Result(-1, "", true));

            var e = assertThrows(GitWorktreeManager.GitCommandException.class, () -> git.statusPorcelain(repoRoot));
            assertTrue(e.getMessage().contains("timed out after 60s"));
        }

        @Test
        @DisplayName("git that cannot start raises with the cause attached")
        void cannotStart() throws IOException {
            var cause = new IOException("Cannot run program \"git\"");
            when(runner.run(any(), any(), any())).thenThrow(cause);

            var e = assertThrows(GitWorktreeManager.GitCommandException.class,
                    () -> git.listWorktrees(repoRoot));
            assertSame(cause, e.getCause());
        }
    }
}
