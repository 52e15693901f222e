package com.pipewright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Per-step result payload stored on the {@link WorkRecord}.
 *
 * @param success    whether the executor reported success
 * @param errors     error lines reported by the executor
 * @param output     step-specific output, may be null when the executor produced none
 * @param recordedAt when the payload was written
 */
public record StepResult(
        boolean success,
        List<String> errors,
        StepOutput output,
        Instant recordedAt
) implements Serializable {

    public StepResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static StepResult succeeded(StepOutput output) {
        return new StepResult(true, List.of(), output, Instant.now());
    }

    public static StepResult failed(StepOutput output, List<String> errors) {
        return new StepResult(false, errors, output, Instant.now());
    }
}
