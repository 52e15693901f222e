package com.pipewright.core.admission;

import com.pipewright.core.admission.AdmissionReport.CheckStatus;
import com.pipewright.core.metrics.PipewrightMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionControllerTest {

    private static AdmissionCheck check(String name, boolean blocking, boolean expensive,
                                        Duration timeout, Callable<CheckOutcome> body) {
        return new AdmissionCheck() {
            @Override public String name() { return name; }
            @Override public boolean blocking() { return blocking; }
            @Override public boolean expensive() { return expensive; }
            @Override public Duration timeout() { return timeout; }
            @Override public CheckOutcome run() throws Exception { return body.call(); }
        };
    }

    private static AdmissionCheck passing(String name) {
        return check(name, true, false, null, () -> CheckOutcome.pass("ok"));
    }

    private static AdmissionController controller(AdmissionCheck... checks) {
        return new AdmissionController(List.of(checks), Duration.ofSeconds(5), Duration.ofSeconds(9),
                new PipewrightMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("all checks passing admits the run")
    void allPass() {
        AdmissionReport report = controller(passing("a"), passing("b")).runChecks(false);

        assertTrue(report.passed());
        assertTrue(report.blockingFailures().isEmpty());
        assertTrue(report.warnings().isEmpty());
        assertEquals(2, report.checksRun().size());
        assertEquals(CheckStatus.PASS, report.checksRun().get(0).status());
    }

    @Test
    @DisplayName("a failed blocking check refuses the run with its fix")
    void blockingFailure() {
        var slots = check("workspace_slots", true, false, null,
                () -> CheckOutcome.fail("All workspace slots occupied (15/15)", "release one"));

        AdmissionReport report = controller(passing("a"), slots).runChecks(false);

        assertFalse(report.passed());
        assertEquals(1, report.blockingFailures().size());
        assertEquals("workspace_slots", report.blockingFailures().get(0).check());
        assertEquals("All workspace slots occupied (15/15)", report.blockingFailures().get(0).error());
        assertEquals("release one", report.blockingFailures().get(0).fix());
        assertEquals(CheckStatus.FAIL, report.checksRun().get(1).status());
    }

    @Test
    @DisplayName("a failed non-blocking check only warns")
    void nonBlockingFailure() {
        var disk = check("disk_space", false, false, null, () -> CheckOutcome.fail("low", "builds may fail"));

        AdmissionReport report = controller(disk).runChecks(false);

        assertTrue(report.passed());
        assertEquals(1, report.warnings().size());
        assertEquals("builds may fail", report.warnings().get(0).impact());
        assertEquals(CheckStatus.WARN, report.checksRun().get(0).status());
    }

    @Test
    @DisplayName("a check that throws becomes a warning and later checks still run")
    void throwingCheck() {
        var broken = check("git_state", true, false, null, () -> {
            throw new IllegalStateException("not a git repository");
        });

        AdmissionReport report = controller(broken, passing("after")).runChecks(false);

        assertTrue(report.passed());
        assertEquals(1, report.warnings().size());
        assertTrue(report.warnings().get(0).message().startsWith("Check could not execute"));
        assertTrue(report.warnings().get(0).message().contains("not a git repository"));
        assertEquals(CheckStatus.ERROR, report.checksRun().get(0).status());
        assertEquals(CheckStatus.PASS, report.checksRun().get(1).status());
    }

    @Test
    @DisplayName("a check that exceeds its timeout becomes a warning")
    void timedOutCheck() {
        var slow = check("self_test", true, false, Duration.ofMillis(100), () -> {
            Thread.sleep(10_000);
            return CheckOutcome.pass("late");
        });

        AdmissionReport report = controller(slow, passing("after")).runChecks(false);

        assertTrue(report.passed());
        assertTrue(report.warnings().get(0).message().contains("timed out"));
        assertEquals(CheckStatus.ERROR, report.checksRun().get(0).status());
        assertEquals(CheckStatus.PASS, report.checksRun().get(1).status());
    }

    @Test
    @DisplayName("expensive checks are skipped on request")
    void skipExpensive() {
        var selfTest = check("self_test", true, true, null, () -> CheckOutcome.fail("broken", "fix it"));

        AdmissionReport quick = controller(selfTest).runChecks(true);
        assertTrue(quick.passed());
        assertEquals(CheckStatus.SKIPPED, quick.checksRun().get(0).status());

        AdmissionReport full = controller(selfTest).runChecks(false);
        assertFalse(full.passed());
    }

    @Test
    @DisplayName("a slow check cannot push the pass past the overall budget")
    void overallBudget() {
        var slow = check("self_test", true, false, Duration.ofSeconds(30), () -> {
            Thread.sleep(10_000);
            return CheckOutcome.pass("late");
        });
        var controller = new AdmissionController(List.of(slow, passing("after")), Duration.ofSeconds(5),
                Duration.ofMillis(300), new PipewrightMetrics(new SimpleMeterRegistry()));

        long started = System.nanoTime();
        AdmissionReport report = controller.runChecks(false);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(elapsedMs < 5_000, "admission took " + elapsedMs + "ms");
        assertTrue(report.passed());
        assertEquals(2, report.warnings().size());
        assertTrue(report.warnings().get(0).message().contains("timed out"));
        assertTrue(report.warnings().get(1).message().contains("budget"));
        assertEquals(CheckStatus.ERROR, report.checksRun().get(1).status());
    }
}
