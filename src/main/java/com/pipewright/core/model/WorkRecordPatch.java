package com.pipewright.core.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A partial update for a {@link WorkRecord}. Null scalar fields leave the
 * record's value untouched.
 */
public record WorkRecordPatch(
        Step currentStep,
        RunStatus status,
        String workspacePath,
        PortPair ports,
        String branchName,
        Map<Step, StepResult> results,
        List<Step> executedSteps,
        List<String> errors
) {

    public WorkRecordPatch {
        results = results == null ? Map.of() : Map.copyOf(results);
        executedSteps = executedSteps == null ? List.of() : List.copyOf(executedSteps);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Step currentStep;
        private RunStatus status;
        private String workspacePath;
        private PortPair ports;
        private String branchName;
        private final Map<Step, StepResult> results = new EnumMap<>(Step.class);
        private final List<Step> executedSteps = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        private Builder() {}

        public Builder currentStep(Step currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder workspace(String workspacePath, PortPair ports) {
            this.workspacePath = workspacePath;
            this.ports = ports;
            return this;
        }

        public Builder branchName(String branchName) {
            this.branchName = branchName;
            return this;
        }

        public Builder result(Step step, StepResult result) {
            this.results.put(step, result);
            return this;
        }

        public Builder executed(Step step) {
            this.executedSteps.add(step);
            return this;
        }

        public Builder error(String error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors.addAll(errors);
            return this;
        }

        public WorkRecordPatch build() {
            return new WorkRecordPatch(currentStep, status, workspacePath, ports, branchName,
                    results, executedSteps, errors);
        }
    }
}
