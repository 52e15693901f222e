package com.pipewright.dispatch.cli;

import com.pipewright.core.engine.RunOutcome;
import com.pipewright.core.events.PipelineEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Pipewright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PIPEWRIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PIPEWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case PipelineEvent.RUN_STARTED -> "@|fg(cyan) [RUN]|@";
            case PipelineEvent.STEP_STARTED -> "@|fg(blue) [STEP]|@";
            case PipelineEvent.STEP_SKIPPED -> "@|fg(white) [SKIP]|@";
            case PipelineEvent.STEP_COMPLETED -> "@|fg(green) [STEP]|@";
            case PipelineEvent.STEP_FAILED -> "@|fg(red),bold [FAILED]|@";
            case PipelineEvent.RUN_CHAINED, PipelineEvent.RUN_AWAITING_TRIGGER -> "@|fg(yellow) [NEXT]|@";
            case PipelineEvent.RUN_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        StringBuilder line = new StringBuilder(prefix).append(' ').append(event.runId());
        if (event.step() != null) {
            line.append(' ').append(event.step());
        }
        line.append(' ').append(describe(event));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString().stripTrailing()));
    }

    /**
     * Prints the final line for a run invocation.
     *
     * @return the process exit code for the outcome
     */
    public static int outcome(RunOutcome outcome) {
        String run = outcome.runId() != null ? "Run " + outcome.runId() : "Work item " + outcome.referenceId();
        switch (outcome.type()) {
            case COMPLETED -> success(run + " completed");
            case CHAINED -> success(run + ": " + outcome.step() + " done, launched " + outcome.nextStep());
            case AWAITING_TRIGGER -> success(run + ": " + outcome.step() + " done, "
                    + outcome.nextStep() + " waits for a trigger");
            case ALREADY_OWNED -> warn(run + " not started: already owned");
            default -> error(run + ": " + outcome.type().name().toLowerCase().replace('_', ' ')
                    + (outcome.step() != null ? " at " + outcome.step() : ""));
        }
        for (String message : outcome.messages()) {
            System.out.println("    " + message);
        }
        return outcome.successful() ? 0 : 1;
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String describe(PipelineEvent event) {
        return switch (event.eventType()) {
            case PipelineEvent.RUN_STARTED -> "for " + event.payload().get("referenceId")
                    + " (" + event.payload().get("template") + ")";
            case PipelineEvent.STEP_SKIPPED -> "already complete";
            case PipelineEvent.STEP_FAILED -> String.valueOf(event.payload().get("error"));
            case PipelineEvent.RUN_CHAINED -> "-> " + event.payload().get("nextStep");
            case PipelineEvent.RUN_AWAITING_TRIGGER -> "next: " + event.payload().get("nextStep") + " (manual)";
            default -> "";
        };
    }
}
