package com.pipewright.core.engine;

import com.pipewright.core.model.PortPair;
import com.pipewright.core.model.Step;

import java.nio.file.Path;

/**
 * Everything an executor needs to perform one step of one run.
 *
 * @param workspace working tree of the run, null when it has none
 * @param ports     port pair of the run's slot, null when it has none
 */
public record StepContext(
        String runId,
        String referenceId,
        String templateName,
        Step step,
        Path workspace,
        PortPair ports
) {}
