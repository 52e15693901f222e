package com.pipewright.core.engine;

import com.pipewright.core.admission.AdmissionController;
import com.pipewright.core.admission.AdmissionReport;
import com.pipewright.core.events.EventBus;
import com.pipewright.core.events.PipelineEvent;
import com.pipewright.core.idempotency.IdempotencyGate;
import com.pipewright.core.idempotency.StepIncompleteException;
import com.pipewright.core.lock.LockRecord;
import com.pipewright.core.lock.OwnershipLock;
import com.pipewright.core.logging.MdcContext;
import com.pipewright.core.metrics.PipewrightMetrics;
import com.pipewright.core.model.RunStatus;
import com.pipewright.core.model.Step;
import com.pipewright.core.model.StepResult;
import com.pipewright.core.model.WorkRecord;
import com.pipewright.core.model.WorkRecordPatch;
import com.pipewright.core.pipeline.ChainingMode;
import com.pipewright.core.pipeline.PipelineCatalog;
import com.pipewright.core.pipeline.PipelineProperties;
import com.pipewright.core.pipeline.PipelineSequencer;
import com.pipewright.core.pipeline.PipelineTemplate;
import com.pipewright.core.state.WorkRecordStore;
import com.pipewright.core.workspace.WorkspaceAllocator;
import com.pipewright.core.workspace.WorkspaceSlot;
import com.pipewright.core.workspace.WorkspaceUnavailableException;
import com.pipewright.core.workspace.WorkspaceValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives runs through their pipeline templates.
 * <p>
 * A new run acquires the ownership lock, gets a workspace and executes its
 * first step. Continuations ({@link #runStep}, {@link #resume}) update the
 * claim the run already holds, take back a claim that lapsed, and stop when
 * a different run holds the work item. Completion is always judged on the
 * output of the run being driven. Each step passes the
 * idempotency gate, runs its executor, has its output re-validated and is
 * persisted before the sequencer decides whether to chain to the next step.
 * <p>
 * A failing step leaves the run on that step with the lock still held, so the
 * same run id can be resumed later.
 */
@Service
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);
    private static final String WRITER = "orchestrator";

    private final WorkRecordStore store;
    private final PipelineCatalog catalog;
    private final PipelineSequencer sequencer;
    private final IdempotencyGate gate;
    private final OwnershipLock lock;
    private final WorkspaceAllocator workspaces;
    private final AdmissionController admission;
    private final StepExecutorRegistry executors;
    private final StepLauncher launcher;
    private final EventBus eventBus;
    private final PipewrightMetrics metrics;
    private final ChainingMode chaining;

    public RunOrchestrator(WorkRecordStore store, PipelineCatalog catalog, PipelineSequencer sequencer,
                           IdempotencyGate gate, OwnershipLock lock, WorkspaceAllocator workspaces,
                           AdmissionController admission, StepExecutorRegistry executors,
                           StepLauncher launcher, EventBus eventBus, PipewrightMetrics metrics,
                           PipelineProperties pipelineProperties) {
        this.store = store;
        this.catalog = catalog;
        this.sequencer = sequencer;
        this.gate = gate;
        this.lock = lock;
        this.workspaces = workspaces;
        this.admission = admission;
        this.executors = executors;
        this.launcher = launcher;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.chaining = pipelineProperties.getChaining();
    }

    /**
     * Starts a new run for a work item.
     */
    public RunOutcome start(StartRequest request) {
        String referenceId = request.referenceId();
        String templateName = request.templateName() != null ? request.templateName() : catalog.defaultTemplate();
        Optional<PipelineTemplate> found = catalog.find(templateName);
        if (found.isEmpty()) {
            return RunOutcome.of(null, referenceId, RunOutcome.Type.REJECTED, null,
                    "Unknown template '" + templateName + "'");
        }
        PipelineTemplate template = found.get();

        if (!request.skipAdmission()) {
            AdmissionReport report = admission.runChecks(request.skipExpensive());
            if (!report.passed()) {
                List<String> reasons = report.blockingFailures().stream()
                        .map(f -> f.check() + ": " + f.error())
                        .toList();
                log.warn("Admission blocked run for {}: {}", referenceId, reasons);
                return new RunOutcome(null, referenceId, RunOutcome.Type.ADMISSION_BLOCKED, null, null, reasons);
            }
        }

        String runId = RunIds.newRunId();
        MdcContext.setRun(runId, referenceId);
        try {
            if (!lock.acquire(referenceId, runId)) {
                String holder = lock.find(referenceId).map(LockRecord::runId).orElse("another run");
                log.info("Work item {} already owned by {}, not starting", referenceId, holder);
                return RunOutcome.of(null, referenceId, RunOutcome.Type.ALREADY_OWNED, null,
                        "Work item " + referenceId + " is owned by run " + holder);
            }

            log.info("Starting run {} for {} with template {}", runId, referenceId, template.name());
            store.save(WorkRecord.create(runId, referenceId, template.name()), WRITER);
            gate.recordStart(referenceId, runId, template.first());
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, runId, null,
                    Map.of("referenceId", referenceId, "template", template.name())));

            WorkspaceSlot slot;
            try {
                slot = workspaces.allocate(runId, request.branchName());
            } catch (WorkspaceUnavailableException e) {
                log.error("No workspace for run {}: {}", runId, e.getMessage());
                store.update(runId, WorkRecordPatch.builder()
                        .status(RunStatus.FAILED)
                        .error("workspace: " + e.getMessage())
                        .build(), WRITER);
                lock.release(referenceId, runId);
                gate.reconcileRecordedStatus(referenceId, RunStatus.FAILED, template.first());
                return RunOutcome.of(runId, referenceId, RunOutcome.Type.WORKSPACE_UNAVAILABLE, null, e.getMessage());
            }

            WorkRecord record = store.update(runId, WorkRecordPatch.builder()
                    .workspace(slot.path(), slot.ports())
                    .branchName(slot.branchName())
                    .build(), WRITER);
            return drive(record, template, template.first());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Executes one step of an existing run. This is what a chained step process calls.
     */
    public RunOutcome runStep(String runId, Step step) {
        Optional<WorkRecord> loaded = store.load(runId);
        if (loaded.isEmpty()) {
            return RunOutcome.of(runId, null, RunOutcome.Type.NOT_FOUND, step, "No readable state for run " + runId);
        }
        WorkRecord record = loaded.get();
        MdcContext.setRun(runId, record.referenceId());
        try {
            Optional<PipelineTemplate> template = catalog.find(record.templateName());
            if (template.isEmpty()) {
                return RunOutcome.of(runId, record.referenceId(), RunOutcome.Type.REJECTED, step,
                        "Run uses unknown template '" + record.templateName() + "'");
            }
            if (!template.get().contains(step)) {
                return RunOutcome.of(runId, record.referenceId(), RunOutcome.Type.REJECTED, step,
                        step + " is not part of template " + record.templateName());
            }
            Optional<RunOutcome> notOwned = claim(record, step);
            if (notOwned.isPresent()) {
                return notOwned.get();
            }

            Optional<RunOutcome> workspaceProblem = ensureWorkspace(record, step);
            if (workspaceProblem.isPresent()) {
                return workspaceProblem.get();
            }
            return drive(store.require(runId), template.get(), step);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues a run from its first step whose output does not validate.
     */
    public RunOutcome resume(String runId) {
        Optional<WorkRecord> loaded = store.load(runId);
        if (loaded.isEmpty()) {
            return RunOutcome.of(runId, null, RunOutcome.Type.NOT_FOUND, null, "No readable state for run " + runId);
        }
        WorkRecord record = loaded.get();
        Optional<PipelineTemplate> found = catalog.find(record.templateName());
        if (found.isEmpty()) {
            return RunOutcome.of(runId, record.referenceId(), RunOutcome.Type.REJECTED, null,
                    "Run uses unknown template '" + record.templateName() + "'");
        }
        PipelineTemplate template = found.get();

        Step resumeAt;
        MdcContext.setRun(runId, record.referenceId());
        try {
            Optional<RunOutcome> notOwned = claim(record, null);
            if (notOwned.isPresent()) {
                return notOwned.get();
            }
            resumeAt = record.currentStep() != null ? record.currentStep() : template.first();
            while (resumeAt != null && gate.isRunComplete(resumeAt, runId)) {
                resumeAt = template.next(resumeAt);
            }
            if (resumeAt == null) {
                Step last = template.steps().get(template.steps().size() - 1);
                log.info("Run {} has nothing left to do", runId);
                return finish(record, last);
            }
            log.info("Resuming run {} at {}", runId, resumeAt);
        } finally {
            MdcContext.clear();
        }
        return runStep(runId, resumeAt);
    }

    /**
     * Confirms the run still owns its work item. A claim that lapsed, through
     * {@code releaseStale} or an operator release, is taken back for the run;
     * a claim held by a different run refuses the continuation.
     *
     * @return the refusal, empty when the run holds the claim
     */
    private Optional<RunOutcome> claim(WorkRecord record, Step step) {
        String runId = record.runId();
        String referenceId = record.referenceId();
        if (lock.updateStatus(referenceId, runId, RunStatus.RUNNING)) {
            return Optional.empty();
        }
        if (lock.acquire(referenceId, runId) && lock.updateStatus(referenceId, runId, RunStatus.RUNNING)) {
            log.warn("Claim of run {} on {} had lapsed, reclaimed it", runId, referenceId);
            return Optional.empty();
        }
        String holder = lock.find(referenceId).map(LockRecord::runId).orElse("another run");
        return Optional.of(RunOutcome.of(runId, referenceId, RunOutcome.Type.NOT_OWNED, step,
                "Run " + runId + " does not own " + referenceId + " (held by " + holder + ")"));
    }

    private RunOutcome drive(WorkRecord record, PipelineTemplate template, Step firstStep) {
        String runId = record.runId();
        String referenceId = record.referenceId();
        Step current = firstStep;

        while (true) {
            MdcContext.setStep(current);
            try {
                if (gate.skipIfRunComplete(current, runId)) {
                    record = store.update(runId, WorkRecordPatch.builder()
                            .currentStep(current)
                            .executed(current)
                            .status(RunStatus.COMPLETED)
                            .build(), WRITER);
                    gate.reconcileRecordedStatus(referenceId, RunStatus.COMPLETED, current);
                    metrics.recordStepResult(current.displayName(), "skipped");
                    eventBus.publish(PipelineEvent.of(PipelineEvent.STEP_SKIPPED, runId, current.displayName(),
                            Map.of()));
                } else {
                    Optional<RunOutcome> failure = execute(record, current);
                    if (failure.isPresent()) {
                        return failure.get();
                    }
                    record = store.require(runId);
                }
            } finally {
                MdcContext.clearStep();
            }

            Step next = sequencer.nextStep(template.name(), current);
            if (next == null) {
                return finish(record, current);
            }
            if (!sequencer.shouldAutoContinue(RunStatus.COMPLETED, current, template.name())) {
                log.info("{} is terminal, {} waits for an external trigger", current, next);
                eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_AWAITING_TRIGGER, runId, current.displayName(),
                        Map.of("nextStep", next.displayName())));
                return new RunOutcome(runId, referenceId, RunOutcome.Type.AWAITING_TRIGGER, current, next, List.of());
            }
            if (chaining == ChainingMode.PROCESS) {
                return chain(record, current, next);
            }
            lock.updateStatus(referenceId, runId, RunStatus.RUNNING);
            current = next;
        }
    }

    /**
     * Runs the executor for one step and persists its result.
     *
     * @return the outcome to stop with, empty when the step completed with valid output
     */
    private Optional<RunOutcome> execute(WorkRecord record, Step step) {
        String runId = record.runId();
        String referenceId = record.referenceId();

        record = store.update(runId, WorkRecordPatch.builder()
                .currentStep(step)
                .status(RunStatus.RUNNING)
                .build(), WRITER);
        lock.updateStatus(referenceId, runId, RunStatus.RUNNING);
        gate.reconcileRecordedStatus(referenceId, RunStatus.RUNNING, step);
        eventBus.publish(PipelineEvent.of(PipelineEvent.STEP_STARTED, runId, step.displayName(), Map.of()));

        long startNanos = System.nanoTime();
        StepExecution execution;
        try {
            execution = executors.forStep(step).execute(contextFor(record, step));
        } catch (RuntimeException e) {
            log.error("Executor for {} crashed", step, e);
            execution = StepExecution.infrastructureError("executor crashed: " + e.getMessage());
        }
        metrics.recordStepDuration(step.displayName(), (System.nanoTime() - startNanos) / 1_000_000);

        switch (execution.outcome()) {
            case INFRASTRUCTURE_ERROR:
                return Optional.of(fail(record, step, null, "infrastructure: " + execution.message(),
                        RunOutcome.Type.INFRASTRUCTURE_FAILURE, "infrastructure_error"));
            case FAILED:
                return Optional.of(fail(record, step, execution.result(), "step failed: " + execution.message(),
                        RunOutcome.Type.FAILED, "failed"));
            default:
                break;
        }

        if (execution.result() != null) {
            store.update(runId, WorkRecordPatch.builder().result(step, execution.result()).build(), WRITER);
        }
        try {
            gate.assertRunComplete(step, runId);
        } catch (StepIncompleteException e) {
            log.error(e.getMessage());
            return Optional.of(fail(store.require(runId), step, null, e.getMessage(),
                    RunOutcome.Type.INCOMPLETE_OUTPUT, "incomplete"));
        }

        store.update(runId, WorkRecordPatch.builder()
                .executed(step)
                .status(RunStatus.COMPLETED)
                .build(), WRITER);
        lock.updateStatus(referenceId, runId, RunStatus.COMPLETED);
        gate.reconcileRecordedStatus(referenceId, RunStatus.COMPLETED, step);
        metrics.recordStepResult(step.displayName(), "completed");
        eventBus.publish(PipelineEvent.of(PipelineEvent.STEP_COMPLETED, runId, step.displayName(), Map.of()));
        log.info("{} completed", step);
        return Optional.empty();
    }

    private RunOutcome fail(WorkRecord record, Step step, StepResult result, String error,
                            RunOutcome.Type type, String metricOutcome) {
        WorkRecordPatch.Builder patch = WorkRecordPatch.builder()
                .status(RunStatus.FAILED)
                .error(step.displayName() + ": " + error);
        if (result != null) {
            patch.result(step, result);
        }
        store.update(record.runId(), patch.build(), WRITER);
        lock.updateStatus(record.referenceId(), record.runId(), RunStatus.FAILED);
        gate.reconcileRecordedStatus(record.referenceId(), RunStatus.FAILED, step);
        metrics.recordStepResult(step.displayName(), metricOutcome);
        eventBus.publish(PipelineEvent.of(PipelineEvent.STEP_FAILED, record.runId(), step.displayName(),
                Map.of("error", error, "type", type.name())));
        log.error("{} failed for run {}: {}", step, record.runId(), error);

        List<String> messages = result != null && !result.errors().isEmpty()
                ? concat(error, result.errors())
                : List.of(error);
        return new RunOutcome(record.runId(), record.referenceId(), type, step, null, messages);
    }

    private RunOutcome chain(WorkRecord record, Step current, Step next) {
        try {
            launcher.launch(record.runId(), next);
        } catch (StepLauncher.StepLaunchException e) {
            log.error("Could not chain to {}: {}", next, e.getMessage());
            store.update(record.runId(), WorkRecordPatch.builder()
                    .error(next.displayName() + ": launch failed: " + e.getMessage())
                    .build(), WRITER);
            return new RunOutcome(record.runId(), record.referenceId(), RunOutcome.Type.LAUNCH_FAILED,
                    current, next, List.of(e.getMessage()));
        }
        eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_CHAINED, record.runId(), current.displayName(),
                Map.of("nextStep", next.displayName())));
        return new RunOutcome(record.runId(), record.referenceId(), RunOutcome.Type.CHAINED, current, next, List.of());
    }

    private RunOutcome finish(WorkRecord record, Step last) {
        store.update(record.runId(), WorkRecordPatch.builder().status(RunStatus.COMPLETED).build(), WRITER);
        lock.release(record.referenceId(), record.runId());
        gate.reconcileRecordedStatus(record.referenceId(), RunStatus.COMPLETED, last);
        eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_COMPLETED, record.runId(), last.displayName(),
                Map.of()));
        log.info("Run {} completed", record.runId());
        return new RunOutcome(record.runId(), record.referenceId(), RunOutcome.Type.COMPLETED, last, null, List.of());
    }

    /**
     * Makes sure the run has a usable workspace before a continuation step runs.
     * Cleanup and verify operate on whatever is left and are not checked.
     */
    private Optional<RunOutcome> ensureWorkspace(WorkRecord record, Step step) {
        if (step == Step.CLEANUP || step == Step.VERIFY) {
            return Optional.empty();
        }
        WorkspaceValidation validation = workspaces.validate(record.runId());
        if (validation.valid()) {
            return Optional.empty();
        }
        log.warn("Workspace of run {} is not usable ({}), re-allocating", record.runId(), validation.problems());
        try {
            workspaces.release(record.runId());
            WorkspaceSlot slot = workspaces.allocate(record.runId(), record.branchName());
            store.update(record.runId(), WorkRecordPatch.builder()
                    .workspace(slot.path(), slot.ports())
                    .branchName(slot.branchName())
                    .build(), WRITER);
            return Optional.empty();
        } catch (WorkspaceUnavailableException e) {
            store.update(record.runId(), WorkRecordPatch.builder()
                    .currentStep(step)
                    .status(RunStatus.FAILED)
                    .error(step.displayName() + ": workspace: " + e.getMessage())
                    .build(), WRITER);
            lock.updateStatus(record.referenceId(), record.runId(), RunStatus.FAILED);
            return Optional.of(RunOutcome.of(record.runId(), record.referenceId(),
                    RunOutcome.Type.WORKSPACE_UNAVAILABLE, step, e.getMessage()));
        }
    }

    private static StepContext contextFor(WorkRecord record, Step step) {
        Path workspace = record.workspacePath() != null ? Path.of(record.workspacePath()) : null;
        return new StepContext(record.runId(), record.referenceId(), record.templateName(), step,
                workspace, record.ports());
    }

    private static List<String> concat(String first, List<String> rest) {
        var all = new ArrayList<String>(rest.size() + 1);
        all.add(first);
        all.addAll(rest);
        return all;
    }
}
