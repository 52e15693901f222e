package com.pipewright.core.admission;

import com.pipewright.core.process.ProcessRunner;
import com.pipewright.core.workspace.WorkspaceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Warns when tools the steps rely on are not installed.
 * <p>
 * This only warns: a step whose tool is missing fails on its own as an
 * infrastructure error, it is never counted as passed.
 */
@Component
@Order(60)
public class ToolchainCheck implements AdmissionCheck {

    private static final Logger log = LoggerFactory.getLogger(ToolchainCheck.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final Map<String, List<String>> tools;
    private final Path workDir;
    private final ProcessRunner processRunner;

    @Autowired
    public ToolchainCheck(AdmissionProperties properties, WorkspaceAllocator allocator) {
        this(properties.getTools(), allocator.repoRoot(), new ProcessRunner());
    }

    ToolchainCheck(Map<String, List<String>> tools, Path workDir, ProcessRunner processRunner) {
        this.tools = new LinkedHashMap<>(tools);
        this.workDir = workDir;
        this.processRunner = processRunner;
    }

    @Override
    public String name() {
        return "toolchain";
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public CheckOutcome run() {
        List<String> missing = new ArrayList<>();
        for (var entry : tools.entrySet()) {
            if (!isAvailable(entry.getKey(), entry.getValue())) {
                missing.add(entry.getKey());
            }
        }
        if (!missing.isEmpty()) {
            return CheckOutcome.fail("Tools not available: " + String.join(", ", missing),
                    "Steps needing these tools will fail as infrastructure errors");
        }
        return CheckOutcome.pass(tools.size() + " tool(s) available: " + String.join(", ", tools.keySet()));
    }

    private boolean isAvailable(String tool, List<String> probe) {
        try {
            return processRunner.run(probe, workDir, PROBE_TIMEOUT).ok();
        } catch (IOException e) {
            log.debug("Tool {} not available: {}", tool, e.getMessage());
            return false;
        }
    }
}
