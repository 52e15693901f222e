package com.pipewright.core.model;

import java.util.List;

/**
 * Baseline captured before any change is built, so later checks can tell
 * pre-existing errors from new ones.
 */
public record ValidateOutput(int baselineErrorCount, List<String> baselineErrors) implements StepOutput {

    public ValidateOutput {
        baselineErrors = baselineErrors == null ? List.of() : List.copyOf(baselineErrors);
    }
}
