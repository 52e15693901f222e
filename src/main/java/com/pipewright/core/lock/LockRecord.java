package com.pipewright.core.lock;

import com.pipewright.core.model.RunStatus;

import java.time.Instant;

/**
 * An active ownership claim on a work item.
 */
public record LockRecord(
        String referenceId,
        String runId,
        RunStatus status,
        Instant acquiredAt,
        Instant updatedAt
) {}
