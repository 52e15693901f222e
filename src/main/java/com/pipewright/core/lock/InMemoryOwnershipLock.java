package com.pipewright.core.lock;

import com.pipewright.core.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link OwnershipLock}. Claims do not survive the process, so this
 * only suits single-process use and tests.
 */
public class InMemoryOwnershipLock implements OwnershipLock {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOwnershipLock.class);

    private final ConcurrentHashMap<String, LockRecord> locks = new ConcurrentHashMap<>();

    @Override
    public boolean acquire(String referenceId, String runId) {
        Instant now = Instant.now();
        LockRecord holder = locks.computeIfAbsent(referenceId,
                ref -> new LockRecord(ref, runId, RunStatus.PENDING, now, now));
        if (!holder.runId().equals(runId)) {
            log.warn("Work item {} already owned by run {}", referenceId, holder.runId());
            return false;
        }
        return true;
    }

    @Override
    public boolean updateStatus(String referenceId, String runId, RunStatus status) {
        LockRecord updated = locks.computeIfPresent(referenceId, (ref, current) ->
                current.runId().equals(runId)
                        ? new LockRecord(ref, runId, status, current.acquiredAt(), Instant.now())
                        : current);
        return updated != null && updated.runId().equals(runId) && updated.status() == status;
    }

    @Override
    public boolean release(String referenceId, String runId) {
        LockRecord current = locks.get(referenceId);
        if (current == null || !current.runId().equals(runId)) {
            log.warn("Run {} does not own work item {}, nothing released", runId, referenceId);
            return false;
        }
        return locks.remove(referenceId, current);
    }

    @Override
    public boolean forceRelease(String referenceId) {
        return locks.remove(referenceId) != null;
    }

    @Override
    public Optional<LockRecord> find(String referenceId) {
        return Optional.ofNullable(locks.get(referenceId));
    }

    @Override
    public List<LockRecord> listActive() {
        var active = new ArrayList<>(locks.values());
        active.sort(Comparator.comparing(LockRecord::acquiredAt));
        return active;
    }

    @Override
    public int releaseStale(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int released = 0;
        for (LockRecord lock : List.copyOf(locks.values())) {
            if (lock.updatedAt().isBefore(cutoff) && locks.remove(lock.referenceId(), lock)) {
                released++;
            }
        }
        return released;
    }
}
