package com.pipewright.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command to completion under a timeout, capturing combined
 * stdout and stderr.
 * <p>
 * Output goes to a temporary file rather than a pipe, so a chatty process can
 * never block on a full buffer while the timeout is being enforced.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    public record Result(int exitCode, String output, boolean timedOut) {
        public boolean ok() {
            return !timedOut && exitCode == 0;
        }

        /**
         * Last {@code n} non-blank lines of output, for error messages.
         */
        public String tail(int n) {
            List<String> lines = output.lines().filter(l -> !l.isBlank()).toList();
            return String.join("\n", lines.subList(Math.max(0, lines.size() - n), lines.size()));
        }
    }

    public Result run(List<String> command, Path workDir, Duration timeout) throws IOException {
        return run(command, workDir, timeout, Map.of());
    }

    /**
     * @throws IOException when the command cannot be started (for example, it is not installed)
     */
    public Result run(List<String> command, Path workDir, Duration timeout, Map<String, String> environment)
            throws IOException {
        log.debug("Running: {} (in {})", String.join(" ", command), workDir);
        Path outputFile = Files.createTempFile("pipewright-proc-", ".log");
        try {
            var builder = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            builder.environment().putAll(environment);
            Process process = builder.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), String.join(" ", command));
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            return new Result(finished ? process.exitValue() : -1, output, !finished);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted running: " + String.join(" ", command));
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }
}
