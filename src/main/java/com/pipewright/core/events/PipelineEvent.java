package com.pipewright.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes, rendered by the CLI.
 *
 * @param eventType event type (e.g. "run.started", "step.completed", "run.chained")
 * @param runId     the run this event belongs to
 * @param step      display name of the step this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String step,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String RUN_STARTED = "run.started";
    public static final String STEP_STARTED = "step.started";
    public static final String STEP_SKIPPED = "step.skipped";
    public static final String STEP_COMPLETED = "step.completed";
    public static final String STEP_FAILED = "step.failed";
    public static final String RUN_CHAINED = "run.chained";
    public static final String RUN_AWAITING_TRIGGER = "run.awaiting-trigger";
    public static final String RUN_COMPLETED = "run.completed";

    public static PipelineEvent of(String eventType, String runId, String step, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, step, payload, Instant.now());
    }

    /**
     * True for the events after which the publishing process does no more work
     * on the run: it finished, failed a step, or handed over to a chained
     * process or an external trigger.
     */
    public boolean endsRun() {
        return RUN_COMPLETED.equals(eventType) || RUN_CHAINED.equals(eventType)
                || RUN_AWAITING_TRIGGER.equals(eventType) || STEP_FAILED.equals(eventType);
    }
}
