package com.pipewright.core.idempotency;

import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import com.pipewright.core.validation.OutputValidator;
import com.pipewright.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a step needs to run, based only on validated output.
 * <p>
 * The recorded status of a work item is never trusted as evidence of completion;
 * it is corrected from validated output by {@link #reconcileRecordedStatus}.
 */
@Service
public class IdempotencyGate {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyGate.class);

    private final OutputValidator validator;
    private final RunStatusRepository statusRepository;

    public IdempotencyGate(OutputValidator validator, RunStatusRepository statusRepository) {
        this.validator = validator;
        this.statusRepository = statusRepository;
    }

    /**
     * True when the step's output validates. Any failure while validating counts as incomplete.
     */
    public boolean isComplete(Step step, String referenceId) {
        try {
            ValidationResult result = validator.validate(step, referenceId);
            if (!result.valid()) {
                log.debug("{} not complete for {}: {}", step, referenceId, result.errors());
            }
            return result.valid();
        } catch (RuntimeException e) {
            log.debug("Validation of {} for {} failed, treating as incomplete: {}", step, referenceId, e.getMessage());
            return false;
        }
    }

    /**
     * Same verdict as {@link #isComplete}, logged so the run log shows why a step ran or not.
     */
    public boolean skipIfComplete(Step step, String referenceId) {
        if (isComplete(step, referenceId)) {
            log.info("{} already complete, skipping", step);
            return true;
        }
        log.info("{} not complete, executing", step);
        return false;
    }

    /**
     * @throws StepIncompleteException when the step's output does not validate
     */
    public void assertComplete(Step step, String referenceId) {
        ValidationResult result = validator.validate(step, referenceId);
        if (!result.valid()) {
            throw new StepIncompleteException(step, result.errors());
        }
        result.warnings().forEach(w -> log.warn("{}: {}", step, w));
    }

    /**
     * Run-scoped variant of {@link #isComplete}: judges the output recorded by
     * {@code runId} only, never another run of the same work item.
     */
    public boolean isRunComplete(Step step, String runId) {
        try {
            ValidationResult result = validator.validateRun(step, runId);
            if (!result.valid()) {
                log.debug("{} not complete for run {}: {}", step, runId, result.errors());
            }
            return result.valid();
        } catch (RuntimeException e) {
            log.debug("Validation of {} for run {} failed, treating as incomplete: {}", step, runId, e.getMessage());
            return false;
        }
    }

    public boolean skipIfRunComplete(Step step, String runId) {
        if (isRunComplete(step, runId)) {
            log.info("{} already complete, skipping", step);
            return true;
        }
        log.info("{} not complete, executing", step);
        return false;
    }

    /**
     * @throws StepIncompleteException when the output recorded by {@code runId} does not validate
     */
    public void assertRunComplete(Step step, String runId) {
        ValidationResult result = validator.validateRun(step, runId);
        if (!result.valid()) {
            throw new StepIncompleteException(step, result.errors());
        }
        result.warnings().forEach(w -> log.warn("{}: {}", step, w));
    }

    /**
     * Corrects the recorded status of a work item when it disagrees with the
     * expected values. Agreement leaves storage untouched. A work item with no
     * recorded status is skipped.
     *
     * @return true when a write happened
     */
    public boolean reconcileRecordedStatus(String referenceId, RunStatus expectedStatus, Step expectedStep) {
        Optional<RecordedStatus> recorded = statusRepository.find(referenceId);
        if (recorded.isEmpty()) {
            log.warn("No recorded status for {}, skipping reconciliation", referenceId);
            return false;
        }
        RecordedStatus current = recorded.get();
        if (current.status() == expectedStatus && Objects.equals(current.currentStep(), expectedStep)) {
            return false;
        }
        log.info("Reconciling recorded status for {}: {} / {} -> {} / {}", referenceId,
                current.status(), current.currentStep(), expectedStatus, expectedStep);
        statusRepository.upsert(new RecordedStatus(referenceId, current.runId(), expectedStatus,
                expectedStep, Instant.now()));
        return true;
    }

    /**
     * Writes the initial recorded status for a run that is just starting.
     */
    public void recordStart(String referenceId, String runId, Step firstStep) {
        statusRepository.upsert(new RecordedStatus(referenceId, runId, RunStatus.PENDING, firstStep, Instant.now()));
    }
}
