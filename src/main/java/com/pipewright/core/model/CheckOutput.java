package com.pipewright.core.model;

import java.util.List;

/**
 * Result object for the tool-driven steps (build, lint, test).
 * <p>
 * A check counts as passed when the tool actually ran and either reported
 * {@code success == true} or, lacking a flag, a summary with zero errors.
 *
 * @param success     explicit success flag from the tool, may be null
 * @param summary     error/warning counts, may be null
 * @param toolFailure set when the tool could not run at all
 * @param failures    individual failure descriptions
 */
public record CheckOutput(
        Boolean success,
        ErrorSummary summary,
        ToolFailure toolFailure,
        List<String> failures
) implements StepOutput {

    public CheckOutput {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static CheckOutput passed(int total) {
        return new CheckOutput(true, new ErrorSummary(total, 0, 0), null, List.of());
    }

    public static CheckOutput failed(List<String> failures) {
        return new CheckOutput(false, new ErrorSummary(failures.size(), failures.size(), 0), null, failures);
    }

    public static CheckOutput toolMissing(String tool, String reason) {
        return new CheckOutput(null, null, new ToolFailure(tool, reason), List.of());
    }

    public boolean hasPassed() {
        if (toolFailure != null) {
            return false;
        }
        if (success != null) {
            return success;
        }
        return summary != null && summary.errors() == 0;
    }

    public record ErrorSummary(int total, int errors, int warnings) {}

    public record ToolFailure(String tool, String reason) {}
}
