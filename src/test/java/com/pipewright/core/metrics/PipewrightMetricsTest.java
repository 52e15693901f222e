package com.pipewright.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipewrightMetricsTest {

    private SimpleMeterRegistry registry;
    private PipewrightMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipewrightMetrics(registry);
    }

    @Test
    @DisplayName("recordStepDuration records a timer per step")
    void recordStepDuration() {
        metrics.recordStepDuration("Build", 1500);
        metrics.recordStepDuration("Build", 500);
        metrics.recordStepDuration("Test", 100);

        var build = registry.find("pipewright.step.duration").tag("step", "Build").timer();
        assertNotNull(build);
        assertEquals(2, build.count());
        assertEquals(1, registry.find("pipewright.step.duration").tag("step", "Test").timer().count());
    }

    @Test
    @DisplayName("recordStepResult counts by step and outcome")
    void recordStepResult() {
        metrics.recordStepResult("Plan", "completed");
        metrics.recordStepResult("Plan", "skipped");
        metrics.recordStepResult("Plan", "completed");

        var completed = registry.find("pipewright.step.results")
                .tag("step", "Plan").tag("outcome", "completed").counter();
        var skipped = registry.find("pipewright.step.results")
                .tag("step", "Plan").tag("outcome", "skipped").counter();

        assertNotNull(completed);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, skipped.count());
    }

    @Test
    @DisplayName("recordAdmission counts passed and blocked admissions")
    void recordAdmission() {
        metrics.recordAdmission(true);
        metrics.recordAdmission(false);
        metrics.recordAdmission(false);

        assertEquals(1.0, registry.find("pipewright.admission.results").tag("result", "passed").counter().count());
        assertEquals(2.0, registry.find("pipewright.admission.results").tag("result", "blocked").counter().count());
    }

    @Test
    @DisplayName("recordWorkspaceOperation tags operation and success")
    void recordWorkspaceOperation() {
        metrics.recordWorkspaceOperation("allocate", true);
        metrics.recordWorkspaceOperation("allocate", false);

        var ok = registry.find("pipewright.workspace.operations")
                .tag("operation", "allocate").tag("success", "true").counter();
        var failed = registry.find("pipewright.workspace.operations")
                .tag("operation", "allocate").tag("success", "false").counter();

        assertEquals(1.0, ok.count());
        assertEquals(1.0, failed.count());
    }
}
