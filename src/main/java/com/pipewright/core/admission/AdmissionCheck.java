package com.pipewright.core.admission;

import java.time.Duration;

/**
 * One independent admission check run before a new run starts.
 * <p>
 * A failed blocking check refuses the run; a failed non-blocking check only
 * produces a warning. A check that throws, or does not finish within its
 * timeout, is reported as a warning whatever its kind.
 */
public interface AdmissionCheck {

    String name();

    boolean blocking();

    /**
     * Expensive checks are skipped when the caller asks for a quick admission.
     */
    default boolean expensive() {
        return false;
    }

    /**
     * Per-check timeout, or null to use the configured default.
     */
    default Duration timeout() {
        return null;
    }

    CheckOutcome run() throws Exception;
}
