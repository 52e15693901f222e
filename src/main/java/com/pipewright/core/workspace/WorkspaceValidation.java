package com.pipewright.core.workspace;

import java.util.List;

/**
 * Three-way agreement check for a workspace: the slot is registered, its
 * directory exists, and git lists it as a worktree.
 */
public record WorkspaceValidation(boolean registered, boolean directoryExists, boolean knownToGit,
                                  List<String> problems) {

    public WorkspaceValidation {
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public boolean valid() {
        return registered && directoryExists && knownToGit;
    }
}
