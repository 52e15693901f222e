package com.pipewright.core.admission;

import com.pipewright.core.admission.AdmissionReport.BlockingFailure;
import com.pipewright.core.admission.AdmissionReport.CheckRun;
import com.pipewright.core.admission.AdmissionReport.CheckStatus;
import com.pipewright.core.admission.AdmissionReport.Warning;
import com.pipewright.core.metrics.PipewrightMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the admission checks before a new run starts and aggregates their results.
 * <p>
 * Checks run one after another, each timed and each under its own timeout. A check
 * that cannot execute is recorded as a warning and never prevents the other checks
 * from running.
 * <p>
 * All checks share one overall budget. A check never gets more time than the
 * budget has left, and checks reached after the budget is spent are not run;
 * they are reported as warnings.
 */
@Service
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final List<AdmissionCheck> checks;
    private final Duration defaultTimeout;
    private final Duration budget;
    private final PipewrightMetrics metrics;

    @Autowired
    public AdmissionController(List<AdmissionCheck> checks, AdmissionProperties properties,
                               @Autowired(required = false) PipewrightMetrics metrics) {
        this(checks, Duration.ofSeconds(properties.getCheckTimeoutSeconds()),
                Duration.ofSeconds(properties.getTotalBudgetSeconds()), metrics);
    }

    public AdmissionController(List<AdmissionCheck> checks, Duration defaultTimeout, Duration budget,
                               PipewrightMetrics metrics) {
        this.checks = List.copyOf(checks);
        this.defaultTimeout = defaultTimeout;
        this.budget = budget;
        this.metrics = metrics;
    }

    public AdmissionReport runChecks(boolean skipExpensive) {
        long started = System.nanoTime();
        long deadline = started + budget.toNanos();
        var failures = new ArrayList<BlockingFailure>();
        var warnings = new ArrayList<Warning>();
        var runs = new ArrayList<CheckRun>();

        ExecutorService executor = newWorker();
        try {
            for (AdmissionCheck check : checks) {
                if (skipExpensive && check.expensive()) {
                    runs.add(new CheckRun(check.name(), CheckStatus.SKIPPED, 0, "Skipped (expensive)"));
                    continue;
                }
                long checkStarted = System.nanoTime();
                Duration remaining = Duration.ofNanos(deadline - checkStarted);
                if (remaining.isNegative() || remaining.isZero()) {
                    log.warn("Admission budget of {}ms used up, '{}' not run", budget.toMillis(), check.name());
                    warnings.add(new Warning(check.name(), "Check not run: admission budget of "
                            + budget.toMillis() + "ms used up", "Result unknown; admission continues without it"));
                    runs.add(new CheckRun(check.name(), CheckStatus.ERROR, 0, "Not run (budget used up)"));
                    continue;
                }
                CheckOutcome outcome;
                try {
                    outcome = execute(executor, check, remaining);
                } catch (CheckExecutionException e) {
                    long elapsed = elapsedMs(checkStarted);
                    log.warn("Admission check '{}' could not execute: {}", check.name(), e.getMessage());
                    warnings.add(new Warning(check.name(), "Check could not execute: " + e.getMessage(),
                            "Result unknown; admission continues without it"));
                    runs.add(new CheckRun(check.name(), CheckStatus.ERROR, elapsed, e.getMessage()));
                    if (e.abandonedWorker()) {
                        executor.shutdownNow();
                        executor = newWorker();
                    }
                    continue;
                }
                long elapsed = elapsedMs(checkStarted);

                if (outcome.passed()) {
                    runs.add(new CheckRun(check.name(), CheckStatus.PASS, elapsed, outcome.details()));
                } else if (check.blocking()) {
                    failures.add(new BlockingFailure(check.name(), outcome.problem(), outcome.remedy()));
                    runs.add(new CheckRun(check.name(), CheckStatus.FAIL, elapsed, outcome.details()));
                } else {
                    warnings.add(new Warning(check.name(), outcome.problem(), outcome.remedy()));
                    runs.add(new CheckRun(check.name(), CheckStatus.WARN, elapsed, outcome.details()));
                }
                log.debug("Admission check '{}' finished in {}ms: {}", check.name(), elapsed,
                        outcome.passed() ? "pass" : "fail");
            }
        } finally {
            executor.shutdownNow();
        }

        boolean passed = failures.isEmpty();
        var report = new AdmissionReport(passed, failures, warnings, runs, elapsedMs(started));
        log.info("Admission {}: {} blocking failure(s), {} warning(s) in {}ms",
                passed ? "passed" : "blocked", failures.size(), warnings.size(), report.totalDurationMs());
        if (metrics != null) {
            metrics.recordAdmission(passed);
        }
        return report;
    }

    private CheckOutcome execute(ExecutorService executor, AdmissionCheck check, Duration remaining)
            throws CheckExecutionException {
        Duration timeout = check.timeout() != null ? check.timeout() : defaultTimeout;
        if (timeout.compareTo(remaining) > 0) {
            timeout = remaining;
        }
        Future<CheckOutcome> future = executor.submit(check::run);
        try {
            CheckOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                throw new CheckExecutionException("check returned no outcome", false);
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CheckExecutionException("timed out after " + timeout.toMillis() + "ms", true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CheckExecutionException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CheckExecutionException("interrupted", true);
        }
    }

    private static ExecutorService newWorker() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "admission-check");
            thread.setDaemon(true);
            return thread;
        });
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static class CheckExecutionException extends Exception {
        private final boolean abandonedWorker;

        CheckExecutionException(String message, boolean abandonedWorker) {
            super(message);
            this.abandonedWorker = abandonedWorker;
        }

        boolean abandonedWorker() {
            return abandonedWorker;
        }
    }
}
