package com.pipewright.core.workspace;

import com.pipewright.core.metrics.PipewrightMetrics;
import com.pipewright.core.model.PortPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hands out isolated workspaces: a git worktree under the trees directory plus
 * a port pair from the pool.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>New run: {@link #allocate} reserves a slot and creates the worktree</li>
 *   <li>Continuation: {@link #allocate} with the same run id returns the existing slot</li>
 *   <li>Cleanup: {@link #release} removes the worktree and frees the slot</li>
 *   <li>Housekeeping: {@link #prune} frees slots whose worktree vanished or that outlived their age</li>
 * </ol>
 *
 * <p>The number of live workspaces never exceeds {@code maxSlots}, regardless of pool size.
 */
@Service
public class WorkspaceAllocator {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceAllocator.class);

    static final String PORTS_ENV_FILE = ".ports.env";

    private final Path repoRoot;
    private final Path treesDir;
    private final int maxSlots;
    private final String baseRef;
    private final String branchPrefix;
    private final PortPool portPool;
    private final SlotRegistry registry;
    private final GitWorktreeManager git;
    private final PipewrightMetrics metrics;

    public WorkspaceAllocator(WorkspaceProperties properties, SlotRegistry registry,
                              GitWorktreeManager git,
                              @Autowired(required = false) PipewrightMetrics metrics) {
        if (properties.getMaxSlots() > properties.getPoolSize()) {
            throw new IllegalArgumentException("max-slots (" + properties.getMaxSlots()
                    + ") exceeds the port pool size (" + properties.getPoolSize() + ")");
        }
        this.repoRoot = Path.of(properties.getRepoRoot()).toAbsolutePath().normalize();
        this.treesDir = repoRoot.resolve(properties.getTreesDir());
        this.maxSlots = properties.getMaxSlots();
        this.baseRef = properties.getBaseRef();
        this.branchPrefix = properties.getBranchPrefix();
        this.portPool = PortPool.from(properties);
        this.registry = registry;
        this.git = git;
        this.metrics = metrics;
    }

    /**
     * Returns the run's workspace, creating it when the run has none.
     *
     * @param branchName branch for a new worktree; null derives one from the run id
     * @throws WorkspaceUnavailableException when all slots are in use or the worktree cannot be created
     */
    public WorkspaceSlot allocate(String runId, String branchName) {
        String branch = branchName != null && !branchName.isBlank() ? branchName : branchPrefix + runId;
        Path worktreePath = treesDir.resolve(runId);

        WorkspaceSlot slot = registry.update(slots -> {
            Optional<WorkspaceSlot> existing = slots.stream().filter(s -> s.runId().equals(runId)).findFirst();
            if (existing.isPresent()) {
                return existing.get();
            }
            if (slots.size() >= maxSlots) {
                throw new WorkspaceUnavailableException("All " + maxSlots + " workspace slots are in use");
            }
            Set<Integer> used = slots.stream().map(WorkspaceSlot::slot).collect(Collectors.toSet());
            int index = portPool.firstFreeSlot(used);
            if (index < 0) {
                throw new WorkspaceUnavailableException("Port pool of " + portPool.size() + " slots is exhausted");
            }
            WorkspaceSlot reserved = new WorkspaceSlot(runId, index, worktreePath.toString(),
                    portPool.portsFor(index), branch, Instant.now());
            slots.add(reserved);
            return reserved;
        });

        if (Files.isDirectory(Path.of(slot.path()))) {
            log.info("Reusing workspace for run {} at {}", runId, slot.path());
            return slot;
        }

        GitWorktreeManager.WorktreeResult result;
        try {
            Files.createDirectories(treesDir);
            result = git.addWorktree(repoRoot, Path.of(slot.path()), slot.branchName(), baseRef);
        } catch (IOException | RuntimeException e) {
            result = GitWorktreeManager.WorktreeResult.failure(e.getMessage());
        }

        if (!result.success()) {
            registry.update(slots -> slots.removeIf(s -> s.runId().equals(runId)));
            recordMetric("allocate", false);
            throw new WorkspaceUnavailableException("Could not create workspace for run " + runId
                    + ": " + result.error());
        }

        writePortsEnv(Path.of(slot.path()), slot.ports());
        recordMetric("allocate", true);
        log.info("Allocated workspace slot {} for run {} at {} (ports {}/{})", slot.slot(), runId,
                slot.path(), slot.ports().backend(), slot.ports().frontend());
        return slot;
    }

    public Optional<WorkspaceSlot> find(String runId) {
        return registry.list().stream().filter(s -> s.runId().equals(runId)).findFirst();
    }

    public List<WorkspaceSlot> list() {
        return registry.list();
    }

    public int liveCount() {
        return registry.list().size();
    }

    public int capacity() {
        return maxSlots;
    }

    public PortPool portPool() {
        return portPool;
    }

    public Path repoRoot() {
        return repoRoot;
    }

    /**
     * Checks that the registry, the filesystem and git agree about the run's workspace.
     */
    public WorkspaceValidation validate(String runId) {
        Optional<WorkspaceSlot> slot = find(runId);
        Path path = slot.map(s -> Path.of(s.path())).orElse(treesDir.resolve(runId));
        List<String> problems = new ArrayList<>();

        boolean registered = slot.isPresent();
        if (!registered) {
            problems.add("No workspace slot registered for run " + runId);
        }
        boolean exists = Files.isDirectory(path);
        if (!exists) {
            problems.add("Workspace directory missing: " + path);
        }
        boolean known;
        try {
            known = exists && git.isRegisteredWorktree(repoRoot, path);
        } catch (GitWorktreeManager.GitCommandException e) {
            known = false;
            problems.add("Could not list worktrees: " + e.getMessage());
        }
        if (exists && !known) {
            problems.add("Git does not list " + path + " as a worktree");
        }
        return new WorkspaceValidation(registered, exists, known, problems);
    }

    /**
     * Removes the run's worktree and frees its slot.
     *
     * @return true when a slot was freed
     */
    public boolean release(String runId) {
        Optional<WorkspaceSlot> slot = find(runId);
        Path path = slot.map(s -> Path.of(s.path())).orElse(treesDir.resolve(runId));
        if (Files.exists(path)) {
            git.removeWorktree(repoRoot, path);
        }
        boolean freed = registry.update(slots -> slots.removeIf(s -> s.runId().equals(runId)));
        recordMetric("release", freed);
        if (freed) {
            log.info("Released workspace for run {}", runId);
        }
        return freed;
    }

    /**
     * Frees slots whose worktree directory no longer exists, and, when {@code maxAge}
     * is given, slots allocated longer ago than that.
     *
     * @return run ids whose slots were freed
     */
    public List<String> prune(Duration maxAge) {
        Instant cutoff = maxAge != null ? Instant.now().minus(maxAge) : null;
        List<WorkspaceSlot> stale = registry.list().stream()
                .filter(s -> !Files.isDirectory(Path.of(s.path()))
                        || (cutoff != null && s.allocatedAt() != null && s.allocatedAt().isBefore(cutoff)))
                .toList();
        var released = new ArrayList<String>();
        for (WorkspaceSlot slot : stale) {
            if (release(slot.runId())) {
                released.add(slot.runId());
            }
        }
        if (!released.isEmpty()) {
            log.info("Pruned {} stale workspace slot(s): {}", released.size(), released);
            recordMetric("prune", true);
        }
        return released;
    }

    /**
     * Slot indexes currently allocated.
     */
    public Set<Integer> allocatedSlots() {
        return new HashSet<>(registry.list().stream().map(WorkspaceSlot::slot).toList());
    }

    private void writePortsEnv(Path worktree, PortPair ports) {
        String content = "BACKEND_PORT=" + ports.backend() + "\n"
                + "FRONTEND_PORT=" + ports.frontend() + "\n";
        try {
            Files.writeString(worktree.resolve(PORTS_ENV_FILE), content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not write {} in {}: {}", PORTS_ENV_FILE, worktree, e.getMessage());
        }
    }

    private void recordMetric(String operation, boolean success) {
        if (metrics != null) {
            metrics.recordWorkspaceOperation(operation, success);
        }
    }
}
