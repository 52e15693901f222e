package com.pipewright.core.admission;

import com.pipewright.core.workspace.GitWorktreeManager;
import com.pipewright.core.workspace.WorkspaceAllocator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Blocks a new run when the main checkout has uncommitted changes.
 * Paths the pipeline itself writes (working trees, state) are ignored.
 */
@Component
@Order(30)
public class RepoCleanlinessCheck implements AdmissionCheck {

    private final GitWorktreeManager git;
    private final Path repoRoot;
    private final List<String> ignoredPaths;

    @Autowired
    public RepoCleanlinessCheck(GitWorktreeManager git, WorkspaceAllocator allocator, AdmissionProperties properties) {
        this(git, allocator.repoRoot(), properties.getIgnoredPaths());
    }

    RepoCleanlinessCheck(GitWorktreeManager git, Path repoRoot, List<String> ignoredPaths) {
        this.git = git;
        this.repoRoot = repoRoot;
        this.ignoredPaths = List.copyOf(ignoredPaths);
    }

    @Override
    public String name() {
        return "git_state";
    }

    @Override
    public boolean blocking() {
        return true;
    }

    @Override
    public CheckOutcome run() {
        List<String> changes = git.statusPorcelain(repoRoot).stream()
                .filter(line -> !isIgnored(line))
                .toList();
        if (!changes.isEmpty()) {
            String sample = String.join(", ", changes.subList(0, Math.min(5, changes.size())));
            return CheckOutcome.fail("Repository has " + changes.size() + " uncommitted change(s): " + sample,
                    "Commit or stash changes in the main checkout before starting a run");
        }
        return CheckOutcome.pass("Working tree clean");
    }

    private boolean isIgnored(String porcelainLine) {
        // "XY path" or "XY old -> new"
        String path = porcelainLine.length() > 3 ? porcelainLine.substring(3).trim() : porcelainLine.trim();
        if (path.startsWith("\"") && path.endsWith("\"") && path.length() > 1) {
            path = path.substring(1, path.length() - 1);
        }
        for (String ignored : ignoredPaths) {
            if (path.startsWith(ignored)) {
                return true;
            }
        }
        return false;
    }
}
