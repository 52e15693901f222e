package com.pipewright.core.model;

import java.util.Locale;

public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    /**
     * Parses a status name ignoring case.
     *
     * @return the status, or null when the name is null or unknown
     */
    public static RunStatus fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
