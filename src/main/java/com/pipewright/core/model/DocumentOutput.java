package com.pipewright.core.model;

import java.util.List;

public record DocumentOutput(List<String> documentFiles) implements StepOutput {

    public DocumentOutput {
        documentFiles = documentFiles == null ? List.of() : List.copyOf(documentFiles);
    }
}
