package com.pipewright.core.admission;

import java.util.List;

/**
 * Aggregated admission result. The run may start exactly when there are no
 * blocking failures; warnings never refuse a run.
 */
public record AdmissionReport(
        boolean passed,
        List<BlockingFailure> blockingFailures,
        List<Warning> warnings,
        List<CheckRun> checksRun,
        long totalDurationMs
) {

    public AdmissionReport {
        blockingFailures = List.copyOf(blockingFailures);
        warnings = List.copyOf(warnings);
        checksRun = List.copyOf(checksRun);
    }

    public record BlockingFailure(String check, String error, String fix) {}

    public record Warning(String check, String message, String impact) {}

    public record CheckRun(String check, CheckStatus status, long durationMs, String details) {}

    public enum CheckStatus { PASS, FAIL, WARN, SKIPPED, ERROR }
}
