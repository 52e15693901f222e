package com.pipewright.core.workspace;

/**
 * Raised when a workspace cannot be provided: every slot is taken, or the
 * working tree could not be created.
 */
public class WorkspaceUnavailableException extends RuntimeException {

    public WorkspaceUnavailableException(String message) {
        super(message);
    }

    public WorkspaceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
