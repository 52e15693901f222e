package com.pipewright.core.engine;

import com.pipewright.core.model.StepResult;

/**
 * What an executor reports back.
 * <p>
 * {@link Outcome#FAILED} means the step ran and found real problems (failing
 * tests, lint errors). {@link Outcome#INFRASTRUCTURE_ERROR} means the step could
 * not produce a trustworthy verdict at all: the tool crashed, timed out, was
 * missing, or wrote output that could not be parsed.
 */
public record StepExecution(Outcome outcome, StepResult result, String message) {

    public enum Outcome { SUCCEEDED, FAILED, INFRASTRUCTURE_ERROR }

    public static StepExecution succeeded(StepResult result) {
        return new StepExecution(Outcome.SUCCEEDED, result, null);
    }

    public static StepExecution failed(StepResult result, String message) {
        return new StepExecution(Outcome.FAILED, result, message);
    }

    public static StepExecution infrastructureError(String message) {
        return new StepExecution(Outcome.INFRASTRUCTURE_ERROR, null, message);
    }
}
