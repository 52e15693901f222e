package com.pipewright.core.logging;

import com.pipewright.core.model.Step;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId and referenceId in MDC")
    void setRun() {
        MdcContext.setRun("a1b2c3d4", "ISSUE-7");
        assertEquals("a1b2c3d4", MDC.get("runId"));
        assertEquals("ISSUE-7", MDC.get("referenceId"));
    }

    @Test
    @DisplayName("setStep uses the step display name and clearStep keeps the run keys")
    void setStep() {
        MdcContext.setRun("a1b2c3d4", "ISSUE-7");
        MdcContext.setStep(Step.BUILD);
        assertEquals("Build", MDC.get("step"));

        MdcContext.clearStep();
        assertNull(MDC.get("step"));
        assertEquals("a1b2c3d4", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes all pipewright MDC keys")
    void clear() {
        MdcContext.setRun("a1b2c3d4", "ISSUE-7");
        MdcContext.setStep(Step.SHIP);
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("referenceId"));
        assertNull(MDC.get("step"));
    }
}
