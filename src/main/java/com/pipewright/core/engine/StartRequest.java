package com.pipewright.core.engine;

/**
 * Request to start a new run.
 *
 * @param templateName   pipeline template, null for the configured default
 * @param skipAdmission  start without running the admission checks
 * @param skipExpensive  skip admission checks marked expensive (the self-test)
 * @param branchName     branch for the workspace, null to derive one from the run id
 */
public record StartRequest(
        String referenceId,
        String templateName,
        boolean skipAdmission,
        boolean skipExpensive,
        String branchName
) {

    public StartRequest {
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("referenceId must not be blank");
        }
    }

    public static StartRequest of(String referenceId, String templateName) {
        return new StartRequest(referenceId, templateName, false, false, null);
    }
}
