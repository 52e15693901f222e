package com.pipewright.core.workspace;

import com.pipewright.core.model.PortPair;

import java.time.Instant;

/**
 * An allocated workspace: a slot index in the port pool, the working tree
 * path and the branch checked out there.
 */
public record WorkspaceSlot(
        String runId,
        int slot,
        String path,
        PortPair ports,
        String branchName,
        Instant allocatedAt
) {}
