package com.pipewright.core.model;

import java.util.Locale;

/**
 * The fixed vocabulary of pipeline steps.
 * <p>
 * Each step carries its display name (used in logs and verdict messages) and the
 * name of the result field whose absence marks the step as incomplete.
 */
public enum Step {
    PLAN("Plan", "plan_file"),
    VALIDATE("Validate", "baseline_errors"),
    BUILD("Build", "build_results"),
    LINT("Lint", "lint_results"),
    TEST("Test", "test_results"),
    REVIEW("Review", "review_results"),
    DOCUMENT("Document", "documentation"),
    SHIP("Ship", "merge_request"),
    CLEANUP("Cleanup", "cleanup_report"),
    VERIFY("Verify", "verification_results");

    private final String displayName;
    private final String resultField;

    Step(String displayName, String resultField) {
        this.displayName = displayName;
        this.resultField = resultField;
    }

    public String displayName() {
        return displayName;
    }

    public String resultField() {
        return resultField;
    }

    /**
     * Resolves a step from its display name or enum constant name, ignoring case.
     *
     * @return the step, or null for null, blank or unknown names
     */
    public static Step fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Step step : values()) {
            if (step.name().equals(normalized)) {
                return step;
            }
        }
        return null;
    }

    /**
     * Like {@link #fromName(String)} but rejects unknown names.
     *
     * @throws IllegalArgumentException when the name is not a known step
     */
    public static Step parse(String name) {
        Step step = fromName(name);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step: " + name);
        }
        return step;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
