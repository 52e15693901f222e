package com.pipewright.core.model;

import java.util.List;

public record ReviewOutput(boolean approved, List<String> blockers, String reportFile) implements StepOutput {

    public ReviewOutput {
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
    }
}
