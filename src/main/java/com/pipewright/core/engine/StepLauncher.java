package com.pipewright.core.engine;

import com.pipewright.core.model.Step;

/**
 * Starts a step of an existing run in a new process, without waiting for it.
 */
@FunctionalInterface
public interface StepLauncher {

    /**
     * @throws StepLaunchException when the process could not be started
     */
    void launch(String runId, Step step);

    class StepLaunchException extends RuntimeException {
        public StepLaunchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
