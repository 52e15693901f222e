package com.pipewright.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.core.persistence.ObjectMappers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkRecordTest {

    @Nested
    @DisplayName("apply")
    class ApplyTests {

        @Test
        @DisplayName("overwrites scalars only when the patch sets them")
        void overwritesNonNullScalars() {
            var record = WorkRecord.create("a1b2c3d4", "ISSUE-7", "sdlc")
                    .apply(WorkRecordPatch.builder()
                            .workspace("/tmp/trees/a1b2c3d4", new PortPair(9100, 9200))
                            .branchName("pipewright/a1b2c3d4")
                            .build());

            var patched = record.apply(WorkRecordPatch.builder().currentStep(Step.PLAN).build());

            assertEquals(Step.PLAN, patched.currentStep());
            assertEquals("/tmp/trees/a1b2c3d4", patched.workspacePath());
            assertEquals(new PortPair(9100, 9200), patched.ports());
            assertEquals("pipewright/a1b2c3d4", patched.branchName());
            assertEquals(RunStatus.PENDING, patched.status());
        }

        @Test
        @DisplayName("accumulates results, executed steps and errors")
        void accumulates() {
            var plan = StepResult.succeeded(new PlanOutput("specs/plan.md", "b", "feature"));
            var build = StepResult.succeeded(CheckOutput.passed(3));

            var record = WorkRecord.create("r1", "ISSUE-1", "sdlc")
                    .apply(WorkRecordPatch.builder().result(Step.PLAN, plan).executed(Step.PLAN).error("first").build())
                    .apply(WorkRecordPatch.builder().result(Step.BUILD, build).executed(Step.BUILD).error("second").build());

            assertEquals(plan, record.result(Step.PLAN).orElseThrow());
            assertEquals(build, record.result(Step.BUILD).orElseThrow());
            assertEquals(List.of(Step.PLAN, Step.BUILD), record.executedSteps());
            assertEquals(List.of("first", "second"), record.errors());
        }

        @Test
        @DisplayName("does not list a step as executed twice")
        void executedStepsAreUnique() {
            var record = WorkRecord.create("r1", "ISSUE-1", "sdlc")
                    .apply(WorkRecordPatch.builder().executed(Step.PLAN).build())
                    .apply(WorkRecordPatch.builder().executed(Step.PLAN).build());

            assertEquals(List.of(Step.PLAN), record.executedSteps());
            assertTrue(record.hasExecuted(Step.PLAN));
            assertFalse(record.hasExecuted(Step.BUILD));
        }

        @Test
        @DisplayName("leaves the original record untouched")
        void immutable() {
            var original = WorkRecord.create("r1", "ISSUE-1", "sdlc");
            original.apply(WorkRecordPatch.builder().status(RunStatus.FAILED).error("boom").build());

            assertEquals(RunStatus.PENDING, original.status());
            assertTrue(original.errors().isEmpty());
        }
    }

    @Nested
    @DisplayName("CheckOutput")
    class CheckOutputTests {

        @Test
        @DisplayName("explicit success flag decides")
        void explicitFlag() {
            assertTrue(new CheckOutput(true, null, null, List.of()).hasPassed());
            assertFalse(new CheckOutput(false, new CheckOutput.ErrorSummary(0, 0, 0), null, List.of()).hasPassed());
        }

        @Test
        @DisplayName("zero-error summary passes without a flag")
        void zeroErrorSummary() {
            assertTrue(new CheckOutput(null, new CheckOutput.ErrorSummary(12, 0, 2), null, List.of()).hasPassed());
            assertFalse(new CheckOutput(null, new CheckOutput.ErrorSummary(12, 1, 0), null, List.of()).hasPassed());
        }

        @Test
        @DisplayName("a tool that never ran does not pass even with a clean summary")
        void toolMissingNeverPasses() {
            var output = new CheckOutput(null, new CheckOutput.ErrorSummary(0, 0, 0),
                    new CheckOutput.ToolFailure("ruff", "not installed"), List.of());
            assertFalse(output.hasPassed());
            assertFalse(CheckOutput.toolMissing("eslint", "not on PATH").hasPassed());
        }
    }

    @Nested
    @DisplayName("Step")
    class StepTests {

        @Test
        @DisplayName("fromName ignores case and rejects unknown names with null")
        void fromName() {
            assertEquals(Step.BUILD, Step.fromName("build"));
            assertEquals(Step.BUILD, Step.fromName("Build"));
            assertEquals(Step.SHIP, Step.fromName(" SHIP "));
            assertNull(Step.fromName("deploy"));
            assertNull(Step.fromName(""));
            assertNull(Step.fromName(null));
        }

        @Test
        @DisplayName("parse throws for unknown names")
        void parseThrows() {
            assertThrows(IllegalArgumentException.class, () -> Step.parse("deploy"));
        }

        @Test
        @DisplayName("toString is the display name")
        void displayName() {
            assertEquals("Plan", Step.PLAN.toString());
        }
    }

    @Test
    @DisplayName("serializes with step-specific output kinds")
    void jsonRoundTrip() throws Exception {
        ObjectMapper mapper = ObjectMappers.standard();
        var record = WorkRecord.create("r1", "ISSUE-1", "sdlc").apply(WorkRecordPatch.builder()
                .currentStep(Step.SHIP)
                .result(Step.TEST, StepResult.failed(CheckOutput.failed(List.of("test_a")), List.of("1 failing")))
                .result(Step.SHIP, StepResult.succeeded(
                        new ShipOutput("https://git.example.com/mr/12", 12, Instant.parse("2026-01-01T00:00:00Z"))))
                .build());

        String json = mapper.writeValueAsString(record);
        assertTrue(json.contains("\"kind\" : \"check\""));
        assertTrue(json.contains("\"kind\" : \"ship\""));

        WorkRecord read = mapper.readValue(json, WorkRecord.class);
        assertEquals(record.results(), read.results());
        assertInstanceOf(ShipOutput.class, read.result(Step.SHIP).orElseThrow().output());
        assertEquals(Step.SHIP, read.currentStep());
    }
}
