package com.pipewright.core.idempotency;

import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import com.pipewright.core.validation.OutputValidator;
import com.pipewright.core.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdempotencyGateTest {

    private OutputValidator validator;
    private RunStatusRepository statuses;
    private IdempotencyGate gate;

    @BeforeEach
    void setUp() {
        validator = mock(OutputValidator.class);
        statuses = spy(new InMemoryRunStatusRepository());
        gate = new IdempotencyGate(validator, statuses);
    }

    @Nested
    @DisplayName("completion")
    class CompletionTests {

        @Test
        @DisplayName("valid output means complete and the step is skipped")
        void validOutputSkips() {
            when(validator.validate(Step.BUILD, "ISSUE-1")).thenReturn(ValidationResult.of(List.of(), List.of()));

            assertTrue(gate.isComplete(Step.BUILD, "ISSUE-1"));
            assertTrue(gate.skipIfComplete(Step.BUILD, "ISSUE-1"));
        }

        @Test
        @DisplayName("invalid output means the step executes")
        void invalidOutputExecutes() {
            when(validator.validate(Step.TEST, "ISSUE-1")).thenReturn(ValidationResult.invalid("no results"));

            assertFalse(gate.isComplete(Step.TEST, "ISSUE-1"));
            assertFalse(gate.skipIfComplete(Step.TEST, "ISSUE-1"));
        }

        @Test
        @DisplayName("a validator exception counts as incomplete")
        void exceptionIsIncomplete() {
            when(validator.validate(Step.PLAN, "ISSUE-1")).thenThrow(new IllegalStateException("disk gone"));

            assertFalse(gate.isComplete(Step.PLAN, "ISSUE-1"));
        }
    }

    @Nested
    @DisplayName("run-scoped completion")
    class RunCompletionTests {

        @Test
        @DisplayName("judges the output of the given run, not the newest run of the work item")
        void usesTheRun() {
            when(validator.validate(Step.TEST, "ISSUE-1")).thenReturn(ValidationResult.of(List.of(), List.of()));
            when(validator.validateRun(Step.TEST, "r1")).thenReturn(ValidationResult.invalid("no test results"));

            assertFalse(gate.isRunComplete(Step.TEST, "r1"));
            assertFalse(gate.skipIfRunComplete(Step.TEST, "r1"));
            assertThrows(StepIncompleteException.class, () -> gate.assertRunComplete(Step.TEST, "r1"));
            verify(validator, never()).validate(Step.TEST, "ISSUE-1");
        }

        @Test
        @DisplayName("valid run output is skipped and passes the post-execution check")
        void validRun() {
            when(validator.validateRun(Step.BUILD, "r1")).thenReturn(ValidationResult.of(List.of(), List.of()));

            assertTrue(gate.skipIfRunComplete(Step.BUILD, "r1"));
            assertDoesNotThrow(() -> gate.assertRunComplete(Step.BUILD, "r1"));
        }

        @Test
        @DisplayName("a validator exception counts as incomplete")
        void exceptionIsIncomplete() {
            when(validator.validateRun(Step.PLAN, "r1")).thenThrow(new IllegalStateException("disk gone"));

            assertFalse(gate.isRunComplete(Step.PLAN, "r1"));
        }
    }

    @Nested
    @DisplayName("assertComplete")
    class AssertCompleteTests {

        @Test
        @DisplayName("passes silently for valid output")
        void valid() {
            when(validator.validate(Step.SHIP, "ISSUE-1"))
                    .thenReturn(ValidationResult.of(List.of(), List.of("no merge time")));

            assertDoesNotThrow(() -> gate.assertComplete(Step.SHIP, "ISSUE-1"));
        }

        @Test
        @DisplayName("names the step and the missing field when output is incomplete")
        void incomplete() {
            when(validator.validate(Step.BUILD, "ISSUE-1")).thenReturn(
                    ValidationResult.invalid("Build step did not record required field 'build_results'"));

            var e = assertThrows(StepIncompleteException.class, () -> gate.assertComplete(Step.BUILD, "ISSUE-1"));
            assertEquals(Step.BUILD, e.getStep());
            assertTrue(e.getMessage().startsWith("Build incomplete after execution"));
            assertTrue(e.getMessage().contains("build_results"));
        }
    }

    @Nested
    @DisplayName("reconcileRecordedStatus")
    class ReconcileTests {

        @Test
        @DisplayName("writes when the recorded status disagrees")
        void writesOnDisagreement() {
            gate.recordStart("ISSUE-1", "r1", Step.PLAN);

            assertTrue(gate.reconcileRecordedStatus("ISSUE-1", RunStatus.COMPLETED, Step.BUILD));

            var recorded = statuses.find("ISSUE-1").orElseThrow();
            assertEquals(RunStatus.COMPLETED, recorded.status());
            assertEquals(Step.BUILD, recorded.currentStep());
            assertEquals("r1", recorded.runId());
        }

        @Test
        @DisplayName("leaves storage untouched when it already agrees")
        void noRedundantWrites() {
            statuses.upsert(new RecordedStatus("ISSUE-1", "r1", RunStatus.RUNNING, Step.TEST, Instant.now()));

            assertFalse(gate.reconcileRecordedStatus("ISSUE-1", RunStatus.RUNNING, Step.TEST));
            assertFalse(gate.reconcileRecordedStatus("ISSUE-1", RunStatus.RUNNING, Step.TEST));

            verify(statuses, times(1)).upsert(any());
        }

        @Test
        @DisplayName("skips work items with no recorded status")
        void skipsUnknown() {
            assertFalse(gate.reconcileRecordedStatus("ISSUE-9", RunStatus.FAILED, Step.BUILD));
            verify(statuses, never()).upsert(any());
        }
    }
}
