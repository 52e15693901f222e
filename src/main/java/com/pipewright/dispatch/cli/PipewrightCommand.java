package com.pipewright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Pipewright.
 */
@Command(
        name = "pipewright",
        mixinStandardHelpOptions = true,
        version = "Pipewright 0.1.0",
        description = "Runs SDLC pipelines step by step with durable state and per-item ownership",
        subcommands = {
                StartCommand.class,
                StepCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                PreflightCommand.class,
                LocksCommand.class,
                WorkspacesCommand.class,
                TemplatesCommand.class,
                PurgeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PipewrightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
