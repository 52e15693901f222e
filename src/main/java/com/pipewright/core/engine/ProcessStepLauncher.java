package com.pipewright.core.engine;

import com.pipewright.core.model.Step;
import com.pipewright.core.state.StateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches {@code <launcher-command> step <run-id> <step>} as a detached process
 * whose output is appended to {@code <state-root>/<run-id>/<step>.log}.
 */
@Component
public class ProcessStepLauncher implements StepLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessStepLauncher.class);

    private final List<String> launcherCommand;
    private final Path logRoot;

    @Autowired
    public ProcessStepLauncher(ExecutorProperties properties, StateProperties stateProperties) {
        this(properties.getLauncherCommand(), Path.of(stateProperties.getRoot()));
    }

    public ProcessStepLauncher(List<String> launcherCommand, Path logRoot) {
        this.launcherCommand = List.copyOf(launcherCommand);
        this.logRoot = logRoot;
    }

    @Override
    public void launch(String runId, Step step) {
        List<String> command = command(runId, step);
        Path logFile = logRoot.resolve(runId).resolve(step.name().toLowerCase() + ".log");
        try {
            Files.createDirectories(logFile.getParent());
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()))
                    .start();
            log.info("Launched {} for run {} (pid {}), logging to {}", step, runId, process.pid(), logFile);
        } catch (IOException e) {
            throw new StepLaunchException("Could not launch " + step + " for run " + runId
                    + ": " + e.getMessage(), e);
        }
    }

    List<String> command(String runId, Step step) {
        var command = new ArrayList<>(launcherCommand);
        command.add("step");
        command.add(runId);
        command.add(step.name().toLowerCase());
        return command;
    }
}
