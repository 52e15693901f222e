package com.pipewright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class PipewrightMetrics {

    private final MeterRegistry registry;

    public PipewrightMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStepDuration(String step, long ms) {
        Timer.builder("pipewright.step.duration")
                .tag("step", step)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "completed", "skipped", "failed", "infrastructure_error" or "incomplete"
     */
    public void recordStepResult(String step, String outcome) {
        Counter.builder("pipewright.step.results")
                .tag("step", step)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAdmission(boolean passed) {
        Counter.builder("pipewright.admission.results")
                .tag("result", passed ? "passed" : "blocked")
                .register(registry)
                .increment();
    }

    /**
     * Records workspace lifecycle operations.
     *
     * @param operation "allocate", "release" or "prune"
     * @param success   whether the operation succeeded
     */
    public void recordWorkspaceOperation(String operation, boolean success) {
        Counter.builder("pipewright.workspace.operations")
                .description("Workspace lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
