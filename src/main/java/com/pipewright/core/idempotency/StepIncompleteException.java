package com.pipewright.core.idempotency;

import com.pipewright.core.model.Step;

import java.util.List;

/**
 * Raised when a step reported success but its recorded output does not
 * satisfy the step's completeness rules.
 */
public class StepIncompleteException extends RuntimeException {

    private final Step step;
    private final List<String> errors;

    public StepIncompleteException(Step step, List<String> errors) {
        super(step + " incomplete after execution: " + String.join("; ", errors));
        this.step = step;
        this.errors = List.copyOf(errors);
    }

    public Step getStep() {
        return step;
    }

    public List<String> getErrors() {
        return errors;
    }
}
