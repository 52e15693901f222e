package com.pipewright.core.model;

import java.util.List;

public record VerifyOutput(boolean verified, List<String> findings) implements StepOutput {

    public VerifyOutput {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
