package com.pipewright.core.engine;

import com.pipewright.core.model.Step;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Chooses the executor for each step: cleanup runs in-process, every other
 * step runs its configured command unless an executor was registered for it.
 */
@Component
public class StepExecutorRegistry {

    private final StepExecutor defaultExecutor;
    private final Map<Step, StepExecutor> executors = new EnumMap<>(Step.class);

    @Autowired
    public StepExecutorRegistry(CommandStepExecutor commandExecutor, CleanupStepExecutor cleanupExecutor) {
        this(commandExecutor);
        register(Step.CLEANUP, cleanupExecutor);
    }

    public StepExecutorRegistry(StepExecutor defaultExecutor) {
        this.defaultExecutor = defaultExecutor;
    }

    public StepExecutorRegistry register(Step step, StepExecutor executor) {
        executors.put(step, executor);
        return this;
    }

    public StepExecutor forStep(Step step) {
        return executors.getOrDefault(step, defaultExecutor);
    }
}
