package com.pipewright.core.admission;

import com.pipewright.core.process.ProcessRunner;
import com.pipewright.core.workspace.WorkspaceAllocator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Blocks a new run when a small self-test of the pipeline fails.
 * <p>
 * A self-test command that cannot be started throws, which the controller
 * reports as a warning rather than a refusal.
 */
@Component
@Order(20)
public class SelfTestCheck implements AdmissionCheck {

    private final List<String> command;
    private final Duration timeout;
    private final Path workDir;
    private final ProcessRunner processRunner;

    @Autowired
    public SelfTestCheck(AdmissionProperties properties, WorkspaceAllocator allocator) {
        this(properties.getSelfTestCommand(), Duration.ofSeconds(properties.getSelfTestTimeoutSeconds()),
                allocator.repoRoot(), new ProcessRunner());
    }

    SelfTestCheck(List<String> command, Duration timeout, Path workDir, ProcessRunner processRunner) {
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.workDir = workDir;
        this.processRunner = processRunner;
    }

    @Override
    public String name() {
        return "self_test";
    }

    @Override
    public boolean blocking() {
        return true;
    }

    @Override
    public boolean expensive() {
        return true;
    }

    @Override
    public Duration timeout() {
        // a little headroom so the process timeout fires first
        return timeout.plusSeconds(1);
    }

    @Override
    public CheckOutcome run() throws IOException {
        if (command.isEmpty()) {
            return CheckOutcome.pass("No self-test configured");
        }
        ProcessRunner.Result result = processRunner.run(command, workDir, timeout);
        if (result.timedOut()) {
            throw new IOException("self-test timed out after " + timeout.toSeconds() + "s");
        }
        if (!result.ok()) {
            return CheckOutcome.fail("Self-test failed (exit code " + result.exitCode() + "): " + result.tail(5),
                    "Fix the failing self-test before starting a run: " + String.join(" ", command));
        }
        return CheckOutcome.pass("Self-test passed");
    }
}
