package com.pipewright.core.engine;

/**
 * Performs one step. Implementations report problems through the returned
 * {@link StepExecution}; an exception escaping {@link #execute} is treated as an
 * infrastructure error.
 */
@FunctionalInterface
public interface StepExecutor {

    StepExecution execute(StepContext context);
}
