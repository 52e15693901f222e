package com.pipewright.core.validation;

import com.pipewright.core.model.CheckOutput;
import com.pipewright.core.model.CleanupOutput;
import com.pipewright.core.model.DocumentOutput;
import com.pipewright.core.model.PlanOutput;
import com.pipewright.core.model.ReviewOutput;
import com.pipewright.core.model.ShipOutput;
import com.pipewright.core.model.Step;
import com.pipewright.core.model.StepOutput;
import com.pipewright.core.model.StepResult;
import com.pipewright.core.model.ValidateOutput;
import com.pipewright.core.model.VerifyOutput;
import com.pipewright.core.model.WorkRecord;
import com.pipewright.core.state.StoredRecord;
import com.pipewright.core.state.WorkRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a step's recorded output is complete.
 * <p>
 * Every rule for a step is evaluated and all violations are reported together,
 * so one call lists everything that is missing. A step whose executor silently
 * did nothing never passes: each step requires its result field to be present.
 */
@Service
public class OutputValidator {

    private static final Logger log = LoggerFactory.getLogger(OutputValidator.class);

    private final WorkRecordStore store;
    private final ValidationProperties properties;

    public OutputValidator(WorkRecordStore store, ValidationProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    /**
     * Validates the step against the most recent run for the work item.
     */
    public ValidationResult validate(Step step, String referenceId) {
        if (referenceId == null || referenceId.isBlank()) {
            return ValidationResult.invalid("No reference id given");
        }
        Optional<StoredRecord> stored = store.findLatestByReference(referenceId);
        if (stored.isEmpty()) {
            return ValidationResult.invalid("No state found for reference " + referenceId);
        }
        return validate(step, stored.get());
    }

    /**
     * Validates the step against a specific run.
     */
    public ValidationResult validateRun(Step step, String runId) {
        Optional<StoredRecord> stored = store.locate(runId);
        if (stored.isEmpty()) {
            return ValidationResult.invalid("No state found for run " + runId);
        }
        return validate(step, stored.get());
    }

    private ValidationResult validate(Step step, StoredRecord stored) {
        ValidationResult result = validate(step, stored.record());
        if (stored.warnings().isEmpty()) {
            return result;
        }
        var warnings = new ArrayList<>(stored.warnings());
        warnings.addAll(result.warnings());
        return ValidationResult.of(result.errors(), warnings);
    }

    public ValidationResult validate(Step step, WorkRecord record) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        StepResult result = record.results().get(step);

        if (result != null && !result.success()) {
            errors.add(step + " step recorded a failed result"
                    + (result.errors().isEmpty() ? "" : ": " + String.join("; ", result.errors())));
        }

        switch (step) {
            case PLAN -> validatePlan(record, result, errors, warnings);
            case VALIDATE -> validateBaseline(result, errors, warnings);
            case BUILD, LINT, TEST -> validateCheck(step, result, errors);
            case REVIEW -> validateReview(result, errors);
            case DOCUMENT -> validateDocumentation(record, result, errors, warnings);
            case SHIP -> validateShip(result, errors, warnings);
            case CLEANUP -> validateCleanup(result, errors, warnings);
            case VERIFY -> validateVerification(result, errors);
        }

        log.debug("Validated {} for run {}: {} error(s), {} warning(s)",
                step, record.runId(), errors.size(), warnings.size());
        return ValidationResult.of(errors, warnings);
    }

    private void validatePlan(WorkRecord record, StepResult result, List<String> errors, List<String> warnings) {
        PlanOutput plan = requireOutput(Step.PLAN, result, PlanOutput.class, errors);
        if (record.workspacePath() == null || record.workspacePath().isBlank()) {
            errors.add("No workspace recorded for run " + record.runId());
        }
        if (plan == null) {
            return;
        }
        if (plan.planFile() == null || plan.planFile().isBlank()) {
            errors.add("Plan step did not record required field '" + Step.PLAN.resultField() + "'");
            return;
        }
        if (plan.branchName() == null && record.branchName() == null) {
            warnings.add("No branch name recorded for run " + record.runId());
        }
        if (record.workspacePath() == null || record.workspacePath().isBlank()) {
            return;
        }

        Path planPath = Path.of(record.workspacePath()).resolve(plan.planFile());
        if (!Files.isRegularFile(planPath)) {
            errors.add("Plan file not found: " + planPath);
            return;
        }
        try {
            long size = Files.size(planPath);
            if (size < properties.getMinPlanBytes()) {
                errors.add("Plan file too small: " + size + " bytes (minimum " + properties.getMinPlanBytes() + ")");
            }
            String content = Files.readString(planPath, StandardCharsets.UTF_8);
            for (String section : properties.getRequiredPlanSections()) {
                if (!content.contains(section)) {
                    errors.add("Plan file missing required section: '" + section + "'");
                }
            }
        } catch (IOException e) {
            errors.add("Plan file unreadable: " + planPath + " (" + e.getMessage() + ")");
        }
    }

    private void validateBaseline(StepResult result, List<String> errors, List<String> warnings) {
        ValidateOutput baseline = requireOutput(Step.VALIDATE, result, ValidateOutput.class, errors);
        if (baseline == null) {
            return;
        }
        if (baseline.baselineErrorCount() > 0) {
            warnings.add("Baseline has " + baseline.baselineErrorCount() + " pre-existing error(s)");
        }
        if (baseline.baselineErrorCount() != baseline.baselineErrors().size() && !baseline.baselineErrors().isEmpty()) {
            warnings.add("Baseline error count " + baseline.baselineErrorCount()
                    + " differs from " + baseline.baselineErrors().size() + " listed error(s)");
        }
    }

    private void validateCheck(Step step, StepResult result, List<String> errors) {
        CheckOutput check = requireOutput(step, result, CheckOutput.class, errors);
        if (check == null) {
            return;
        }
        if (check.toolFailure() != null) {
            errors.add(step + " tool did not run (" + check.toolFailure().tool() + "): "
                    + check.toolFailure().reason());
            return;
        }
        if (check.success() == null && check.summary() == null) {
            errors.add(step + " results carry neither a success flag nor an error summary");
            return;
        }
        if (!check.hasPassed()) {
            int errorCount = check.summary() != null ? check.summary().errors() : check.failures().size();
            errors.add(step + " results do not show success (" + errorCount + " error(s))");
        }
    }

    private void validateReview(StepResult result, List<String> errors) {
        ReviewOutput review = requireOutput(Step.REVIEW, result, ReviewOutput.class, errors);
        if (review != null && !review.approved()) {
            errors.add("Review did not approve the change"
                    + (review.blockers().isEmpty() ? "" : ": " + String.join("; ", review.blockers())));
        }
    }

    private void validateDocumentation(WorkRecord record, StepResult result, List<String> errors, List<String> warnings) {
        DocumentOutput docs = requireOutput(Step.DOCUMENT, result, DocumentOutput.class, errors);
        if (docs == null) {
            return;
        }
        if (docs.documentFiles().isEmpty()) {
            warnings.add("No documentation files recorded");
            return;
        }
        if (record.workspacePath() != null) {
            for (String file : docs.documentFiles()) {
                if (!Files.exists(Path.of(record.workspacePath()).resolve(file))) {
                    warnings.add("Documentation file not found in workspace: " + file);
                }
            }
        }
    }

    private void validateShip(StepResult result, List<String> errors, List<String> warnings) {
        ShipOutput ship = requireOutput(Step.SHIP, result, ShipOutput.class, errors);
        if (ship == null) {
            return;
        }
        if (ship.mergeRequestUrl() == null || ship.mergeRequestUrl().isBlank()) {
            errors.add("Ship step did not record a durable merge request reference");
        }
        if (ship.shippedAt() == null) {
            warnings.add("Ship step did not record when the change was merged");
        }
    }

    private void validateCleanup(StepResult result, List<String> errors, List<String> warnings) {
        CleanupOutput cleanup = requireOutput(Step.CLEANUP, result, CleanupOutput.class, errors);
        if (cleanup == null) {
            return;
        }
        if (!cleanup.workspaceRemoved()) {
            warnings.add("Workspace was not removed during cleanup");
        }
        if (!cleanup.slotReleased()) {
            warnings.add("Workspace slot was not released during cleanup");
        }
    }

    private void validateVerification(StepResult result, List<String> errors) {
        VerifyOutput verify = requireOutput(Step.VERIFY, result, VerifyOutput.class, errors);
        if (verify != null && !verify.verified()) {
            errors.add("Verification failed"
                    + (verify.findings().isEmpty() ? "" : ": " + String.join("; ", verify.findings())));
        }
    }

    private static <T extends StepOutput> T requireOutput(Step step, StepResult result, Class<T> type,
                                                          List<String> errors) {
        StepOutput output = result != null ? result.output() : null;
        if (output == null) {
            errors.add(step + " step did not record required field '" + step.resultField() + "'");
            return null;
        }
        if (!type.isInstance(output)) {
            errors.add(step + " step recorded " + output.getClass().getSimpleName()
                    + " where " + type.getSimpleName() + " was expected");
            return null;
        }
        return type.cast(output);
    }
}
