package com.pipewright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable state of one pipeline run.
 * <p>
 * Instances are immutable; changes are applied through {@link #apply(WorkRecordPatch)},
 * which only ever adds step results and executed steps, never removes them.
 *
 * @param runId         short identifier of the run
 * @param referenceId   identifier of the work item the run is about
 * @param templateName  pipeline template driving the run
 * @param currentStep   step most recently entered, null before the first step
 * @param executedSteps steps that finished with validated output, in order
 * @param results       per-step result payloads
 * @param workspacePath isolated working tree, null until allocated
 * @param ports         port pair of the workspace slot, null until allocated
 * @param branchName    branch checked out in the workspace
 * @param status        lifecycle status
 * @param errors        accumulated error lines, newest last
 * @param createdAt     when the run was created
 * @param updatedAt     last write
 */
public record WorkRecord(
        String runId,
        String referenceId,
        String templateName,
        Step currentStep,
        List<Step> executedSteps,
        Map<Step, StepResult> results,
        String workspacePath,
        PortPair ports,
        String branchName,
        RunStatus status,
        List<String> errors,
        Instant createdAt,
        Instant updatedAt
) implements Serializable {

    public WorkRecord {
        executedSteps = executedSteps == null ? List.of() : List.copyOf(executedSteps);
        results = results == null || results.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(results));
        errors = errors == null ? List.of() : List.copyOf(errors);
        status = status == null ? RunStatus.PENDING : status;
    }

    public static WorkRecord create(String runId, String referenceId, String templateName) {
        Instant now = Instant.now();
        return new WorkRecord(runId, referenceId, templateName, null, List.of(), Map.of(),
                null, null, null, RunStatus.PENDING, List.of(), now, now);
    }

    public Optional<StepResult> result(Step step) {
        return Optional.ofNullable(results.get(step));
    }

    public boolean hasExecuted(Step step) {
        return executedSteps.contains(step);
    }

    /**
     * Returns a copy with the patch applied. Scalar fields in the patch replace
     * the current values when non-null; results, executed steps and errors are
     * accumulated.
     */
    public WorkRecord apply(WorkRecordPatch patch) {
        Map<Step, StepResult> mergedResults = new EnumMap<>(Step.class);
        mergedResults.putAll(results);
        mergedResults.putAll(patch.results());

        List<Step> mergedExecuted = new ArrayList<>(executedSteps);
        for (Step step : patch.executedSteps()) {
            if (!mergedExecuted.contains(step)) {
                mergedExecuted.add(step);
            }
        }

        List<String> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(patch.errors());

        return new WorkRecord(
                runId,
                referenceId,
                templateName,
                patch.currentStep() != null ? patch.currentStep() : currentStep,
                mergedExecuted,
                mergedResults,
                patch.workspacePath() != null ? patch.workspacePath() : workspacePath,
                patch.ports() != null ? patch.ports() : ports,
                patch.branchName() != null ? patch.branchName() : branchName,
                patch.status() != null ? patch.status() : status,
                mergedErrors,
                createdAt,
                Instant.now());
    }
}
