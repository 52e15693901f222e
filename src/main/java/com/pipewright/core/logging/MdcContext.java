package com.pipewright.core.logging;

import com.pipewright.core.model.Step;
import org.slf4j.MDC;

/**
 * Utility for managing Pipewright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String referenceId) {
        MDC.put("runId", runId);
        MDC.put("referenceId", referenceId);
    }

    public static void setStep(Step step) {
        MDC.put("step", step.displayName());
    }

    public static void clearStep() {
        MDC.remove("step");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("referenceId");
        MDC.remove("step");
    }
}
