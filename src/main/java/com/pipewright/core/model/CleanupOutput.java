package com.pipewright.core.model;

public record CleanupOutput(boolean workspaceRemoved, boolean slotReleased) implements StepOutput {}
