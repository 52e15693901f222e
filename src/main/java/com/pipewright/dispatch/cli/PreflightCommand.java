package com.pipewright.dispatch.cli;

import com.pipewright.core.admission.AdmissionController;
import com.pipewright.core.admission.AdmissionReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: pipewright preflight
 * <p>
 * Runs the admission checks a new run would face and prints the report.
 * Exits with 1 when a blocking check fails.
 */
@Command(name = "preflight", mixinStandardHelpOptions = true, description = "Run admission checks")
@Component
public class PreflightCommand implements Callable<Integer> {

    @Option(names = "--skip-expensive", description = "Skip expensive checks such as the self-test")
    private boolean skipExpensive;

    private final AdmissionController admission;

    public PreflightCommand(AdmissionController admission) {
        this.admission = admission;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        AdmissionReport report = admission.runChecks(skipExpensive);
        for (AdmissionReport.CheckRun run : report.checksRun()) {
            String label = run.check() + ": " + (run.details() != null ? run.details() : run.status().name())
                    + " (" + run.durationMs() + "ms)";
            switch (run.status()) {
                case PASS -> ConsoleOutput.success(label);
                case FAIL -> ConsoleOutput.error(label);
                case WARN, ERROR -> ConsoleOutput.warn(label);
                case SKIPPED -> ConsoleOutput.info(label);
            }
        }

        for (AdmissionReport.BlockingFailure failure : report.blockingFailures()) {
            System.out.println();
            ConsoleOutput.error(failure.check() + ": " + failure.error());
            if (failure.fix() != null) {
                System.out.println("    fix: " + failure.fix());
            }
        }
        for (AdmissionReport.Warning warning : report.warnings()) {
            ConsoleOutput.warn(warning.check() + ": " + warning.message()
                    + (warning.impact() != null ? " (" + warning.impact() + ")" : ""));
        }

        System.out.println("──────────────────────────────────");
        if (report.passed()) {
            ConsoleOutput.success("Admission passed in " + report.totalDurationMs() + "ms");
            return 0;
        }
        ConsoleOutput.error("Admission blocked: " + report.blockingFailures().size() + " blocking failure(s)");
        return 1;
    }
}
