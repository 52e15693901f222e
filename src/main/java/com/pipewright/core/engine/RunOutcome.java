package com.pipewright.core.engine;

import com.pipewright.core.model.Step;

import java.util.List;

/**
 * Result of one orchestrator invocation.
 *
 * @param step     last step the invocation dealt with, null when none was reached
 * @param nextStep step waiting to run, when the invocation stopped before the end of the template
 */
public record RunOutcome(
        String runId,
        String referenceId,
        Type type,
        Step step,
        Step nextStep,
        List<String> messages
) {

    public enum Type {
        /** The template's last step completed. */
        COMPLETED,
        /** A step completed and the next one was launched in a new process. */
        CHAINED,
        /** A step completed; the next one waits for an external trigger. */
        AWAITING_TRIGGER,
        /** The step ran and reported real problems. */
        FAILED,
        /** The step could not produce a verdict (crash, timeout, missing tool, unparseable output). */
        INFRASTRUCTURE_FAILURE,
        /** The step reported success but its output does not validate. */
        INCOMPLETE_OUTPUT,
        /** Another run holds the work item. */
        ALREADY_OWNED,
        /** A continuation was requested for a run that does not hold its work item. */
        NOT_OWNED,
        ADMISSION_BLOCKED,
        WORKSPACE_UNAVAILABLE,
        NOT_FOUND,
        /** Invalid request: unknown template, or a step outside the run's template. */
        REJECTED,
        LAUNCH_FAILED
    }

    public RunOutcome {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static RunOutcome of(String runId, String referenceId, Type type, Step step, String message) {
        return new RunOutcome(runId, referenceId, type, step, null, message == null ? List.of() : List.of(message));
    }

    public boolean successful() {
        return type == Type.COMPLETED || type == Type.CHAINED || type == Type.AWAITING_TRIGGER;
    }
}
