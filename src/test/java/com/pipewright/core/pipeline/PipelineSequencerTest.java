package com.pipewright.core.pipeline;

import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineSequencerTest {

    private PipelineSequencer sequencer;

    @BeforeEach
    void setUp() {
        var properties = new PipelineProperties();
        properties.setTemplates(Map.of("pbt", List.of("Plan", "Build", "Test")));
        sequencer = new PipelineSequencer(new PipelineCatalog(properties));
    }

    @Nested
    @DisplayName("nextStep")
    class NextStepTests {

        @Test
        @DisplayName("returns the successor within the template")
        void successor() {
            assertEquals(Step.TEST, sequencer.nextStep("pbt", "Build"));
            assertEquals(Step.BUILD, sequencer.nextStep("pbt", "plan"));
            assertEquals(Step.LINT, sequencer.nextStep("sdlc_complete", Step.BUILD));
        }

        @Test
        @DisplayName("returns null at the last step")
        void lastStep() {
            assertNull(sequencer.nextStep("pbt", "Test"));
            assertNull(sequencer.nextStep("sdlc_complete", Step.VERIFY));
        }

        @Test
        @DisplayName("returns null for a step outside the template or an unknown template")
        void outside() {
            assertNull(sequencer.nextStep("pbt", "Ship"));
            assertNull(sequencer.nextStep("pbt", "Deploy"));
            assertNull(sequencer.nextStep("no_such_template", "Plan"));
        }

        @Test
        @DisplayName("returns null for null or empty inputs")
        void nullInputs() {
            assertNull(sequencer.nextStep(null, "Plan"));
            assertNull(sequencer.nextStep("", "Plan"));
            assertNull(sequencer.nextStep("pbt", (String) null));
            assertNull(sequencer.nextStep("pbt", ""));
            assertNull(sequencer.nextStep("pbt", (Step) null));
        }
    }

    @Nested
    @DisplayName("shouldAutoContinue")
    class AutoContinueTests {

        @Test
        @DisplayName("completed non-terminal step continues")
        void completedNonTerminal() {
            assertTrue(sequencer.shouldAutoContinue("completed", "Build"));
            assertTrue(sequencer.shouldAutoContinue(RunStatus.COMPLETED, Step.PLAN));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Ship", "Cleanup", "Verify"})
        @DisplayName("terminal steps never continue")
        void terminal(String step) {
            assertFalse(sequencer.shouldAutoContinue("completed", step));
        }

        @ParameterizedTest
        @EnumSource(value = RunStatus.class, names = {"PENDING", "RUNNING", "FAILED"})
        @DisplayName("any status other than completed never continues")
        void otherStatuses(RunStatus status) {
            for (Step step : Step.values()) {
                assertFalse(sequencer.shouldAutoContinue(status, step), status + " / " + step);
            }
        }

        @Test
        @DisplayName("unknown status or step does not continue")
        void unknownInputs() {
            assertFalse(sequencer.shouldAutoContinue("done", "Build"));
            assertFalse(sequencer.shouldAutoContinue("completed", "Deploy"));
            assertFalse(sequencer.shouldAutoContinue((String) null, (String) null));
            assertFalse(sequencer.shouldAutoContinue((RunStatus) null, (Step) null));
        }

        @Test
        @DisplayName("knowing the next step is independent from being allowed to trigger it")
        void independence() {
            assertEquals(Step.CLEANUP, sequencer.nextStep("sdlc_complete", Step.SHIP));
            assertFalse(sequencer.shouldAutoContinue(RunStatus.COMPLETED, Step.SHIP));
        }

        @Test
        @DisplayName("the template's last step is terminal for that template")
        void lastStepOfTemplate() {
            assertTrue(sequencer.shouldAutoContinue(RunStatus.COMPLETED, Step.TEST));
            assertFalse(sequencer.shouldAutoContinue(RunStatus.COMPLETED, Step.TEST, "pbt"));
            assertTrue(sequencer.shouldAutoContinue(RunStatus.COMPLETED, Step.BUILD, "pbt"));
            assertFalse(sequencer.shouldAutoContinue(RunStatus.COMPLETED, Step.BUILD, "unknown"));
        }
    }
}
