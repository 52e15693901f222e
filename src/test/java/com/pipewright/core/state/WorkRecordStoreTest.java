package com.pipewright.core.state;

import com.pipewright.core.model.CheckOutput;
import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import com.pipewright.core.model.StepResult;
import com.pipewright.core.model.WorkRecord;
import com.pipewright.core.model.WorkRecordPatch;
import com.pipewright.core.persistence.ObjectMappers;
import com.pipewright.core.pipeline.PipelineCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkRecordStoreTest {

    @TempDir
    Path root;

    private StateLocator locator;
    private WorkRecordStore store;

    @BeforeEach
    void setUp() {
        locator = new StateLocator(root.resolve("agents"), root.resolve("trees"), "run_state.json");
        store = new WorkRecordStore(locator, PipelineCatalog.standard());
    }

    private void writeLegacy(WorkRecord record) throws Exception {
        Path path = locator.legacyPath(record.runId());
        Files.createDirectories(path.getParent());
        ObjectMappers.standard().writeValue(path.toFile(), record);
    }

    private void writeCorruptCanonical(String runId) throws Exception {
        Path canonical = locator.canonicalPath(runId);
        Files.createDirectories(canonical.getParent());
        Files.writeString(canonical, "{ corrupt");
    }

    private static WorkRecord at(WorkRecord record, Instant updatedAt) {
        return new WorkRecord(record.runId(), record.referenceId(), record.templateName(), record.currentStep(),
                record.executedSteps(), record.results(), record.workspacePath(), record.ports(),
                record.branchName(), record.status(), record.errors(), record.createdAt(), updatedAt);
    }

    @Nested
    @DisplayName("load and save")
    class LoadSaveTests {

        @Test
        @DisplayName("saved record loads back from the canonical location")
        void saveThenLoad() {
            var record = WorkRecord.create("a1b2c3d4", "ISSUE-1", "sdlc");
            store.save(record, "test");

            assertTrue(Files.isRegularFile(locator.canonicalPath("a1b2c3d4")));
            var stored = store.locate("a1b2c3d4").orElseThrow();
            assertEquals(StateLocation.CANONICAL, stored.location());
            assertTrue(stored.warnings().isEmpty());
            assertEquals(record, stored.record());
        }

        @Test
        @DisplayName("missing run is not found")
        void missingRun() {
            assertTrue(store.load("nope").isEmpty());
            assertThrows(WorkRecordNotFoundException.class, () -> store.require("nope"));
        }

        @Test
        @DisplayName("corrupt canonical state fails closed without falling back to legacy")
        void corruptCanonical() throws Exception {
            writeLegacy(WorkRecord.create("r1", "ISSUE-1", "sdlc"));
            Path canonical = locator.canonicalPath("r1");
            Files.createDirectories(canonical.getParent());
            Files.writeString(canonical, "{ \"runId\": \"r1\", \"results\": ");

            assertTrue(store.locate("r1").isEmpty());
        }

        @Test
        @DisplayName("rejects a current step outside the run's template")
        void rejectsForeignStep() {
            var record = WorkRecord.create("r1", "ISSUE-1", "plan_build")
                    .apply(WorkRecordPatch.builder().currentStep(Step.SHIP).build());

            assertThrows(IllegalStateException.class, () -> store.save(record, "test"));
            assertFalse(Files.exists(locator.canonicalPath("r1")));
        }

        @Test
        @DisplayName("update merges the patch and persists it")
        void update() {
            store.save(WorkRecord.create("r1", "ISSUE-1", "sdlc"), "test");

            store.update("r1", WorkRecordPatch.builder()
                    .currentStep(Step.BUILD)
                    .status(RunStatus.RUNNING)
                    .result(Step.BUILD, StepResult.succeeded(CheckOutput.passed(4)))
                    .build(), "test");

            var loaded = store.require("r1");
            assertEquals(Step.BUILD, loaded.currentStep());
            assertEquals(RunStatus.RUNNING, loaded.status());
            assertTrue(loaded.result(Step.BUILD).isPresent());
        }

        @Test
        @DisplayName("delete removes canonical state only")
        void delete() throws Exception {
            store.save(WorkRecord.create("r1", "ISSUE-1", "sdlc"), "test");
            writeLegacy(WorkRecord.create("r1", "ISSUE-1", "sdlc"));

            assertTrue(store.delete("r1"));
            assertFalse(Files.exists(locator.canonicalPath("r1")));
            assertTrue(Files.exists(locator.legacyPath("r1")));
            assertFalse(store.delete("r1"));
        }
    }

    @Nested
    @DisplayName("legacy fallback")
    class LegacyTests {

        @Test
        @DisplayName("state only at the legacy location loads with a warning")
        void legacyOnly() throws Exception {
            writeLegacy(WorkRecord.create("r1", "ISSUE-1", "sdlc"));

            var stored = store.locate("r1").orElseThrow();
            assertEquals(StateLocation.LEGACY, stored.location());
            assertTrue(stored.fromLegacyLocation());
            assertEquals(1, stored.warnings().size());
            assertTrue(stored.warnings().get(0).contains("legacy location"));
        }

        @Test
        @DisplayName("canonical state wins over differing legacy state")
        void canonicalWins() throws Exception {
            writeLegacy(WorkRecord.create("r1", "ISSUE-1", "sdlc")
                    .apply(WorkRecordPatch.builder().status(RunStatus.FAILED).build()));
            store.save(WorkRecord.create("r1", "ISSUE-1", "sdlc")
                    .apply(WorkRecordPatch.builder().status(RunStatus.COMPLETED).build()), "test");

            var stored = store.locate("r1").orElseThrow();
            assertEquals(StateLocation.CANONICAL, stored.location());
            assertEquals(RunStatus.COMPLETED, stored.record().status());
        }

        @Test
        @DisplayName("saving a legacy-loaded record writes the canonical location only")
        void saveNeverWritesLegacy() throws Exception {
            writeLegacy(WorkRecord.create("r1", "ISSUE-1", "sdlc"));
            String legacyBefore = Files.readString(locator.legacyPath("r1"));

            store.update("r1", WorkRecordPatch.builder().status(RunStatus.RUNNING).build(), "test");

            assertEquals(legacyBefore, Files.readString(locator.legacyPath("r1")));
            assertEquals(StateLocation.CANONICAL, store.locate("r1").orElseThrow().location());
        }
    }

    @Nested
    @DisplayName("findLatestByReference")
    class FindLatestTests {

        @Test
        @DisplayName("returns the most recently updated run of the work item")
        void newestWins() {
            store.save(at(WorkRecord.create("old00001", "ISSUE-9", "sdlc"), Instant.parse("2026-01-01T00:00:00Z")), "t");
            store.save(at(WorkRecord.create("new00002", "ISSUE-9", "sdlc"), Instant.parse("2026-02-01T00:00:00Z")), "t");
            store.save(at(WorkRecord.create("other003", "ISSUE-3", "sdlc"), Instant.parse("2026-03-01T00:00:00Z")), "t");

            var latest = store.findLatestByReference("ISSUE-9").orElseThrow();
            assertEquals("new00002", latest.record().runId());
        }

        @Test
        @DisplayName("falls back to legacy runs with a warning")
        void legacyFallback() throws Exception {
            writeLegacy(WorkRecord.create("legacy01", "ISSUE-5", "sdlc"));

            var latest = store.findLatestByReference("ISSUE-5").orElseThrow();
            assertEquals("legacy01", latest.record().runId());
            assertFalse(latest.warnings().isEmpty());
        }

        @Test
        @DisplayName("a run with unreadable canonical state is not answered from its legacy copy")
        void corruptCanonicalNotFromLegacy() throws Exception {
            writeLegacy(WorkRecord.create("r1", "ISSUE-7", "sdlc")
                    .apply(WorkRecordPatch.builder()
                            .result(Step.BUILD, StepResult.succeeded(CheckOutput.passed(3)))
                            .build()));
            writeCorruptCanonical("r1");

            assertTrue(store.findLatestByReference("ISSUE-7").isEmpty());
        }

        @Test
        @DisplayName("an unreadable newer run is not replaced by an older run of the same work item")
        void corruptCanonicalNotFromOlderRun() throws Exception {
            store.save(at(WorkRecord.create("old00001", "ISSUE-7", "sdlc"), Instant.parse("2026-01-01T00:00:00Z")), "t");
            writeLegacy(at(WorkRecord.create("new00002", "ISSUE-7", "sdlc"), Instant.parse("2026-02-01T00:00:00Z")));
            writeCorruptCanonical("new00002");

            assertTrue(store.findLatestByReference("ISSUE-7").isEmpty());
        }

        @Test
        @DisplayName("legacy copies of runs with canonical state are ignored")
        void canonicalShadowsLegacyCopy() throws Exception {
            store.save(WorkRecord.create("r1", "ISSUE-2", "sdlc"), "t");
            writeLegacy(WorkRecord.create("r1", "ISSUE-8", "sdlc"));

            assertTrue(store.findLatestByReference("ISSUE-8").isEmpty());
        }

        @Test
        @DisplayName("unknown or blank reference finds nothing")
        void nothing() {
            assertTrue(store.findLatestByReference("ISSUE-404").isEmpty());
            assertTrue(store.findLatestByReference("").isEmpty());
        }
    }

    @Test
    @DisplayName("locator lists state files per location")
    void stateFiles() throws Exception {
        store.save(WorkRecord.create("r1", "ISSUE-1", "sdlc"), "t");
        store.save(WorkRecord.create("r2", "ISSUE-2", "sdlc"), "t");
        Files.writeString(root.resolve("agents").resolve("workspace_slots.json"), "[]");

        List<Path> files = locator.stateFiles(StateLocation.CANONICAL);
        assertEquals(2, files.size());
        assertTrue(locator.stateFiles(StateLocation.LEGACY).isEmpty());
    }
}
