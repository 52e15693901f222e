package com.pipewright.core.state;

/**
 * Thrown when a run has no readable state at any location.
 */
public class WorkRecordNotFoundException extends RuntimeException {

    private final String runId;

    public WorkRecordNotFoundException(String runId) {
        super("No state found for run " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
