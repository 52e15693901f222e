package com.pipewright.core.idempotency;

import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;

import java.time.Instant;

/**
 * Status of a work item as tracked outside the run's own state file.
 */
public record RecordedStatus(
        String referenceId,
        String runId,
        RunStatus status,
        Step currentStep,
        Instant updatedAt
) {}
