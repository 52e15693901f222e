package com.pipewright.core.workspace;

import com.pipewright.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Thin wrapper over the {@code git} CLI for worktree lifecycle and repository status.
 *
 * <p>This class shells out to {@code git} through a {@link ProcessRunner}. Every command
 * runs under a timeout; a command that cannot be started or does not finish in
 * time raises {@link GitCommandException}, while a command that ran and failed is
 * reported through its exit code.
 */
public class GitWorktreeManager {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeManager.class);

    private final Duration timeout;
    private final ProcessRunner processRunner;

    public GitWorktreeManager(Duration timeout) {
        this(timeout, new ProcessRunner());
    }

    public GitWorktreeManager(Duration timeout, ProcessRunner processRunner) {
        this.timeout = timeout;
        this.processRunner = processRunner;
    }

    public record GitResult(int exitCode, String output) {
        public boolean ok() {
            return exitCode == 0;
        }
    }

    public record WorktreeResult(boolean success, Path worktreePath, String error) {
        public static WorktreeResult success(Path path) {
            return new WorktreeResult(true, path, null);
        }
        public static WorktreeResult failure(String error) {
            return new WorktreeResult(false, null, error);
        }
    }

    /**
     * Raised when git could not be run at all or timed out.
     */
    public static class GitCommandException extends RuntimeException {
        public GitCommandException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Adds a worktree on a new branch from {@code baseRef}. When the branch already
     * exists from an earlier attempt, checks it out instead.
     */
    public WorktreeResult addWorktree(Path repoRoot, Path worktreePath, String branchName, String baseRef) {
        if (repoRoot == null || !Files.isDirectory(repoRoot)) {
            return WorktreeResult.failure("Repository root does not exist: " + repoRoot);
        }

        log.info("Adding worktree at {} (branch: {}, base: {})", worktreePath, branchName, baseRef);

        GitResult result = runGit(repoRoot, "worktree", "add", "-b", branchName,
                worktreePath.toString(), baseRef);

        if (!result.ok()) {
            log.info("Branch {} may already exist, trying to check out existing branch", branchName);
            result = runGit(repoRoot, "worktree", "add", worktreePath.toString(), branchName);

            if (!result.ok()) {
                String error = "Failed to create worktree at " + worktreePath
                        + " (exit code " + result.exitCode() + "): " + result.output().trim();
                log.error(error);
                return WorktreeResult.failure(error);
            }
        }

        return WorktreeResult.success(worktreePath);
    }

    /**
     * Removes a worktree, falling back to deleting the directory and pruning
     * git's bookkeeping when {@code git worktree remove} fails.
     */
    public boolean removeWorktree(Path repoRoot, Path worktreePath) {
        if (repoRoot == null || !Files.isDirectory(repoRoot)) {
            log.warn("Cannot remove worktree: repository root {} does not exist", repoRoot);
            return false;
        }

        log.info("Removing worktree at {}", worktreePath);
        GitResult result = runGit(repoRoot, "worktree", "remove", "--force", worktreePath.toString());

        if (!result.ok()) {
            log.warn("git worktree remove failed for {}, attempting manual cleanup", worktreePath);
            deleteDirectory(worktreePath);
            runGit(repoRoot, "worktree", "prune");
        }
        return !Files.exists(worktreePath);
    }

    /**
     * Lists the paths of all worktrees git knows for the repository, the main one included.
     */
    public List<Path> listWorktrees(Path repoRoot) {
        GitResult result = runGit(repoRoot, "worktree", "list", "--porcelain");
        if (!result.ok()) {
            return List.of();
        }
        var paths = new ArrayList<Path>();
        for (String line : result.output().split("\n")) {
            if (line.startsWith("worktree ")) {
                paths.add(Path.of(line.substring("worktree ".length()).trim()));
            }
        }
        return paths;
    }

    public boolean isRegisteredWorktree(Path repoRoot, Path worktreePath) {
        Path target = normalize(worktreePath);
        return listWorktrees(repoRoot).stream().map(GitWorktreeManager::normalize).anyMatch(target::equals);
    }

    /**
     * Returns the lines of {@code git status --porcelain}; empty when the tree is clean.
     *
     * @throws GitCommandException when git cannot run or the directory is not a repository
     */
    public List<String> statusPorcelain(Path repoRoot) {
        GitResult result = runGit(repoRoot, "status", "--porcelain");
        if (!result.ok()) {
            throw new GitCommandException("git status failed (exit code " + result.exitCode() + "): "
                    + result.output().trim(), null);
        }
        return result.output().lines().filter(line -> !line.isBlank()).toList();
    }

    /**
     * Runs a git command and returns its exit code and combined output.
     */
    GitResult runGit(Path workDir, String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        try {
            ProcessRunner.Result result = processRunner.run(command, workDir, timeout);
            if (result.timedOut()) {
                throw new GitCommandException("git " + String.join(" ", args)
                        + " timed out after " + timeout.toSeconds() + "s", null);
            }
            result.output().lines().forEach(line -> log.debug("git: {}", line));
            return new GitResult(result.exitCode(), result.output());
        } catch (IOException e) {
            throw new GitCommandException("Git command failed: " + String.join(" ", command), e);
        }
    }

    private static Path normalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    private void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to delete directory {}: {}", dir, e.getMessage());
        }
    }
}
