package com.pipewright.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.core.model.CheckOutput;
import com.pipewright.core.model.Step;
import com.pipewright.core.model.StepResult;
import com.pipewright.core.persistence.ObjectMappers;
import com.pipewright.core.process.ProcessRunner;
import com.pipewright.core.state.StateProperties;
import com.pipewright.core.workspace.WorkspaceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a step by running its configured external command.
 * <p>
 * The command runs in the run's workspace (or the repository root when the run
 * has none) with the run's coordinates in its environment, and must write a
 * {@link StepResult} as JSON to the path in {@code PIPEWRIGHT_RESULT_FILE}.
 * The exit code alone never decides success: a command that exits cleanly
 * without writing a result is an infrastructure error.
 */
@Component
public class CommandStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandStepExecutor.class);

    private final Map<Step, List<String>> commands;
    private final Duration timeout;
    private final Path resultsRoot;
    private final Path fallbackWorkDir;
    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper = ObjectMappers.standard();

    @Autowired
    public CommandStepExecutor(ExecutorProperties properties, StateProperties stateProperties,
                               WorkspaceProperties workspaceProperties) {
        this(parseCommands(properties.getCommands()), Duration.ofSeconds(properties.getTimeoutSeconds()),
                Path.of(stateProperties.getRoot()), Path.of(workspaceProperties.getRepoRoot()), new ProcessRunner());
    }

    public CommandStepExecutor(Map<Step, List<String>> commands, Duration timeout, Path resultsRoot,
                               Path fallbackWorkDir, ProcessRunner processRunner) {
        this.commands = commands.isEmpty() ? new EnumMap<>(Step.class) : new EnumMap<>(commands);
        this.timeout = timeout;
        this.resultsRoot = resultsRoot.toAbsolutePath();
        this.fallbackWorkDir = fallbackWorkDir.toAbsolutePath();
        this.processRunner = processRunner;
    }

    @Override
    public StepExecution execute(StepContext context) {
        Step step = context.step();
        List<String> command = commands.get(step);
        if (command == null || command.isEmpty()) {
            return StepExecution.infrastructureError("No executor configured for step " + step);
        }

        Path workDir = context.workspace() != null && Files.isDirectory(context.workspace())
                ? context.workspace()
                : fallbackWorkDir;
        Path resultFile = resultFile(context.runId(), step);

        ProcessRunner.Result run;
        try {
            Files.createDirectories(resultFile.getParent());
            Files.deleteIfExists(resultFile);
            log.info("Running {} command: {}", step, String.join(" ", command));
            run = processRunner.run(command, workDir, timeout, environment(context, resultFile));
        } catch (IOException e) {
            return StepExecution.infrastructureError("Could not run " + step + " command '"
                    + command.get(0) + "': " + e.getMessage());
        }

        if (run.timedOut()) {
            return StepExecution.infrastructureError(step + " command timed out after " + timeout.toSeconds() + "s");
        }
        if (!Files.isRegularFile(resultFile)) {
            return StepExecution.infrastructureError(step + " command exited with code " + run.exitCode()
                    + " without writing a result" + describeTail(run));
        }

        StepResult result;
        try {
            result = objectMapper.readValue(resultFile.toFile(), StepResult.class);
        } catch (JsonProcessingException e) {
            return StepExecution.infrastructureError("Unparseable " + step + " result in " + resultFile
                    + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            return StepExecution.infrastructureError("Could not read " + step + " result in " + resultFile
                    + ": " + e.getMessage());
        }
        if (result == null) {
            return StepExecution.infrastructureError("Empty " + step + " result in " + resultFile);
        }
        if (result.recordedAt() == null) {
            result = new StepResult(result.success(), result.errors(), result.output(), Instant.now());
        }

        if (result.output() instanceof CheckOutput check && check.toolFailure() != null) {
            return StepExecution.infrastructureError(step + " tool '" + check.toolFailure().tool()
                    + "' did not run: " + check.toolFailure().reason());
        }
        if (!result.success()) {
            return StepExecution.failed(result, step + " reported " + result.errors().size() + " error(s)");
        }
        if (!run.ok()) {
            return StepExecution.infrastructureError(step + " command reported success but exited with code "
                    + run.exitCode() + describeTail(run));
        }
        return StepExecution.succeeded(result);
    }

    Path resultFile(String runId, Step step) {
        return resultsRoot.resolve(runId).resolve("results").resolve(step.name().toLowerCase() + ".json");
    }

    public boolean hasCommand(Step step) {
        return commands.containsKey(step);
    }

    private static Map<String, String> environment(StepContext context, Path resultFile) {
        Map<String, String> env = new HashMap<>();
        env.put("PIPEWRIGHT_RUN_ID", context.runId());
        env.put("PIPEWRIGHT_REFERENCE_ID", context.referenceId());
        env.put("PIPEWRIGHT_TEMPLATE", context.templateName());
        env.put("PIPEWRIGHT_STEP", context.step().displayName());
        env.put("PIPEWRIGHT_RESULT_FILE", resultFile.toString());
        if (context.workspace() != null) {
            env.put("PIPEWRIGHT_WORKSPACE", context.workspace().toString());
        }
        if (context.ports() != null) {
            env.put("BACKEND_PORT", String.valueOf(context.ports().backend()));
            env.put("FRONTEND_PORT", String.valueOf(context.ports().frontend()));
        }
        return env;
    }

    private static String describeTail(ProcessRunner.Result run) {
        String tail = run.tail(3);
        return tail.isEmpty() ? "" : ": " + tail;
    }

    private static Map<Step, List<String>> parseCommands(Map<String, List<String>> configured) {
        Map<Step, List<String>> commands = new EnumMap<>(Step.class);
        configured.forEach((name, command) -> commands.put(Step.parse(name), List.copyOf(command)));
        return commands;
    }
}
