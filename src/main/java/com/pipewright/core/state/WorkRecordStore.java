package com.pipewright.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.core.model.WorkRecord;
import com.pipewright.core.model.WorkRecordPatch;
import com.pipewright.core.persistence.ObjectMappers;
import com.pipewright.core.pipeline.PipelineCatalog;
import com.pipewright.core.pipeline.PipelineTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * File-backed store for {@link WorkRecord}s, one JSON document per run.
 * <p>
 * Reads try the canonical location first and fall back to the legacy location,
 * reporting a warning when the fallback is used. Writes always go to the
 * canonical location. A state file that exists but cannot be parsed is treated
 * as absent: callers never see a partially populated record.
 */
@Service
public class WorkRecordStore {

    private static final Logger log = LoggerFactory.getLogger(WorkRecordStore.class);

    private final StateLocator locator;
    private final PipelineCatalog catalog;
    private final ObjectMapper objectMapper;

    @Autowired
    public WorkRecordStore(StateProperties properties, PipelineCatalog catalog) {
        this(StateLocator.from(properties), catalog);
    }

    public WorkRecordStore(StateLocator locator, PipelineCatalog catalog) {
        this.locator = locator;
        this.catalog = catalog;
        this.objectMapper = ObjectMappers.standard();
    }

    public Optional<WorkRecord> load(String runId) {
        return locate(runId).map(StoredRecord::record);
    }

    /**
     * Loads a run's state together with where it was found.
     *
     * @return empty when no location holds the run, or when the first
     *         location that does holds unreadable content
     */
    public Optional<StoredRecord> locate(String runId) {
        if (runId == null || runId.isBlank()) {
            return Optional.empty();
        }
        for (StateLocator.Candidate candidate : locator.candidates(runId)) {
            if (!Files.isRegularFile(candidate.path())) {
                continue;
            }
            Optional<WorkRecord> record = read(candidate.path());
            if (record.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(stored(record.get(), candidate));
        }
        log.debug("No state found for run {}", runId);
        return Optional.empty();
    }

    public WorkRecord require(String runId) {
        return load(runId).orElseThrow(() -> new WorkRecordNotFoundException(runId));
    }

    /**
     * Finds the most recently updated run for a work item. Canonical state
     * shadows legacy state: the legacy copy of a run is never read when the
     * run has a canonical state file, and the legacy location is consulted
     * only when the canonical location holds no run for the reference.
     * <p>
     * A run whose canonical state is unreadable is not found. When its legacy
     * copy shows that it belongs to the reference, the whole lookup fails
     * closed rather than answering with that copy or with an older run.
     */
    public Optional<StoredRecord> findLatestByReference(String referenceId) {
        if (referenceId == null || referenceId.isBlank()) {
            return Optional.empty();
        }
        Set<String> canonicalRuns = new HashSet<>();
        Set<String> unreadable = new HashSet<>();
        List<WorkRecord> canonical = new ArrayList<>();
        for (Path file : locator.stateFiles(StateLocation.CANONICAL)) {
            String runId = runIdOf(file);
            canonicalRuns.add(runId);
            Optional<WorkRecord> record = read(file);
            if (record.isEmpty()) {
                unreadable.add(runId);
            } else if (referenceId.equals(record.get().referenceId())) {
                canonical.add(record.get());
            }
        }

        List<WorkRecord> legacy = new ArrayList<>();
        for (Path file : locator.stateFiles(StateLocation.LEGACY)) {
            String runId = runIdOf(file);
            if (canonicalRuns.contains(runId) && !unreadable.contains(runId)) {
                continue;
            }
            Optional<WorkRecord> record = read(file).filter(r -> referenceId.equals(r.referenceId()));
            if (record.isEmpty()) {
                continue;
            }
            if (unreadable.contains(runId)) {
                log.warn("Canonical state of run {} for {} is unreadable; treating {} as not found",
                        runId, referenceId, referenceId);
                return Optional.empty();
            }
            legacy.add(record.get());
        }

        if (!canonical.isEmpty()) {
            WorkRecord latest = latest(canonical);
            return Optional.of(stored(latest, new StateLocator.Candidate(StateLocation.CANONICAL,
                    locator.canonicalPath(latest.runId()))));
        }
        if (!legacy.isEmpty()) {
            WorkRecord latest = latest(legacy);
            return Optional.of(stored(latest, new StateLocator.Candidate(StateLocation.LEGACY,
                    locator.legacyPath(latest.runId()))));
        }
        return Optional.empty();
    }

    private static WorkRecord latest(List<WorkRecord> records) {
        return records.stream()
                .max(Comparator.comparing(WorkRecord::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseThrow();
    }

    private static String runIdOf(Path stateFile) {
        return stateFile.getParent().getFileName().toString();
    }

    /**
     * Persists the record at the canonical location.
     *
     * @param writer name of the component performing the write, for the log
     * @throws IllegalStateException when the current step is not part of the run's template
     */
    public void save(WorkRecord record, String writer) {
        checkCurrentStep(record);
        Path target = locator.canonicalPath(record.runId());
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".state-", ".json");
            objectMapper.writeValue(temp.toFile(), record);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved state for run {} (writer: {}, step: {}, status: {})",
                    record.runId(), writer, record.currentStep(), record.status());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save state for run " + record.runId(), e);
        }
    }

    public WorkRecord merge(WorkRecord record, WorkRecordPatch patch) {
        return record.apply(patch);
    }

    /**
     * Loads, patches and saves a run in one call.
     *
     * @throws WorkRecordNotFoundException when the run has no readable state
     */
    public WorkRecord update(String runId, WorkRecordPatch patch, String writer) {
        WorkRecord merged = merge(require(runId), patch);
        save(merged, writer);
        return merged;
    }

    /**
     * Removes the canonical state of a run. Legacy state is never modified.
     *
     * @return true when a state file was deleted
     */
    public boolean delete(String runId) {
        Path target = locator.canonicalPath(runId);
        try {
            boolean deleted = Files.deleteIfExists(target);
            Path dir = target.getParent();
            if (Files.isDirectory(dir)) {
                try (var remaining = Files.list(dir)) {
                    if (remaining.findAny().isEmpty()) {
                        Files.delete(dir);
                    }
                }
            }
            if (deleted) {
                log.info("Deleted state for run {}", runId);
            }
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete state for run " + runId, e);
        }
    }

    private Optional<WorkRecord> read(Path path) {
        try {
            WorkRecord record = objectMapper.readValue(path.toFile(), WorkRecord.class);
            if (record == null || record.runId() == null || record.referenceId() == null) {
                log.warn("State at {} is missing its run or reference id; treating as not found", path);
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable state at {}; treating as not found: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private StoredRecord stored(WorkRecord record, StateLocator.Candidate candidate) {
        List<String> warnings = new ArrayList<>();
        if (candidate.location() == StateLocation.LEGACY) {
            String warning = "State for run " + record.runId() + " read from legacy location "
                    + candidate.path() + "; it will be written to the canonical location on next save";
            log.warn(warning);
            warnings.add(warning);
        }
        return new StoredRecord(record, candidate.location(), warnings);
    }

    private void checkCurrentStep(WorkRecord record) {
        if (catalog == null || record.currentStep() == null) {
            return;
        }
        Optional<PipelineTemplate> template = catalog.find(record.templateName());
        if (template.isPresent() && !template.get().contains(record.currentStep())) {
            throw new IllegalStateException("Step " + record.currentStep()
                    + " is not part of template " + record.templateName());
        }
    }
}
