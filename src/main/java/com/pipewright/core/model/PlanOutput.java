package com.pipewright.core.model;

/**
 * @param planFile   plan artifact path, relative to the workspace
 * @param branchName branch the run works on
 * @param issueClass classification of the work item (feature, bug, chore)
 */
public record PlanOutput(String planFile, String branchName, String issueClass) implements StepOutput {}
