package com.pipewright.core.lock;

import com.pipewright.core.model.RunStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Mutual exclusion of runs over a work item: at most one run holds a reference id.
 * <p>
 * Claims are durable and survive process exit, so a run continued by a later
 * process still owns its work item. New runs acquire; continuations update the
 * status of the claim they hold and acquire again only when that claim lapsed.
 */
public interface OwnershipLock {

    /**
     * Claims the work item for a run. Claiming again with the same run id succeeds.
     *
     * @return false when another run holds the work item
     */
    boolean acquire(String referenceId, String runId);

    /**
     * Updates the status of a claim held by the run.
     *
     * @return false when the run does not hold the work item
     */
    boolean updateStatus(String referenceId, String runId, RunStatus status);

    /**
     * Releases a claim held by the run.
     *
     * @return false when the run does not hold the work item
     */
    boolean release(String referenceId, String runId);

    /**
     * Releases a claim regardless of which run holds it.
     *
     * @return true when a claim existed
     */
    boolean forceRelease(String referenceId);

    Optional<LockRecord> find(String referenceId);

    List<LockRecord> listActive();

    /**
     * Releases claims not updated for longer than {@code maxAge}.
     *
     * @return number of claims released
     */
    int releaseStale(Duration maxAge);
}
